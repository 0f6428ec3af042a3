package io.b2mash.b2b.contractassembly.contract;

/** Contract lifecycle. Pins, answers and slot choices are frozen from COMPLETED on. */
public enum ContractStatus {
  DRAFT,
  COMPLETED,
  ARCHIVED;

  public boolean isFrozen() {
    return this != DRAFT;
  }
}
