package io.b2mash.b2b.contractassembly.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level switches bound from {@code contract-assembly.*}.
 *
 * @param publishing publishing gate settings
 * @param validation contract validation settings
 */
@ConfigurationProperties(prefix = "contract-assembly")
public record ContractAssemblyProperties(Publishing publishing, Validation validation) {

  public ContractAssemblyProperties {
    publishing = publishing != null ? publishing : new Publishing(false);
    validation = validation != null ? validation : new Validation(true);
  }

  /**
   * @param requireChangelog when true a missing changelog on version 2+ blocks submission instead
   *     of producing a warning
   */
  public record Publishing(boolean requireChangelog) {}

  /**
   * @param revalidateOnChange re-run the rule engine after every answer or slot change
   */
  public record Validation(boolean revalidateOnChange) {}

  public static ContractAssemblyProperties defaults() {
    return new ContractAssemblyProperties(null, null);
  }
}
