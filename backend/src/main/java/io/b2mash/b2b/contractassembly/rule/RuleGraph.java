package io.b2mash.b2b.contractassembly.rule;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Immutable snapshot of the rules declared by a set of clause versions.
 *
 * <p>Versions are held in an arena indexed by version id and by entity id; rules reference other
 * clauses by entity id only. When two nodes share an entity the one added last is the one resolved
 * for that entity, which lets a candidate version stand in for its entity's published version.
 *
 * <p>{@code incompatible_with} edges are indexed under both endpoints when the graph is built, so
 * callers never need to care which side declared the rule. Instances are safe to share between
 * threads.
 */
public final class RuleGraph {

  static final Comparator<UUID> ID_ORDER = Comparator.comparing(UUID::toString);

  private final Map<UUID, RuleGraphNode> byVersionId;
  private final Map<UUID, RuleGraphNode> byEntityId;
  private final Map<UUID, List<IncompatibleEdge>> incompatibleIndex;

  private RuleGraph(Collection<RuleGraphNode> nodes) {
    Map<UUID, RuleGraphNode> versions = new LinkedHashMap<>();
    Map<UUID, RuleGraphNode> entities = new LinkedHashMap<>();
    for (RuleGraphNode node : nodes) {
      versions.put(node.versionId(), node);
      entities.put(node.entityId(), node);
    }
    this.byVersionId = Collections.unmodifiableMap(versions);
    this.byEntityId = Collections.unmodifiableMap(entities);
    this.incompatibleIndex = buildIncompatibleIndex(entities.values());
  }

  public static RuleGraph of(Collection<RuleGraphNode> nodes) {
    return new RuleGraph(nodes);
  }

  public static RuleGraph empty() {
    return new RuleGraph(List.of());
  }

  /** Resolves the node standing for the given clause (logical entity). */
  public Optional<RuleGraphNode> resolve(UUID entityId) {
    return Optional.ofNullable(byEntityId.get(entityId));
  }

  public Optional<RuleGraphNode> resolveVersion(UUID versionId) {
    return Optional.ofNullable(byVersionId.get(versionId));
  }

  public boolean containsEntity(UUID entityId) {
    return byEntityId.containsKey(entityId);
  }

  public Collection<RuleGraphNode> nodes() {
    return byVersionId.values();
  }

  /**
   * Returns every {@code incompatible_with} edge touching the given clause, whether declared by it
   * or by the other side. Declared edges come first, in rule order.
   */
  public List<IncompatibleEdge> incompatibleWith(UUID entityId) {
    return incompatibleIndex.getOrDefault(entityId, List.of());
  }

  /**
   * Finds cycles over {@code requires} edges between the clauses of this graph. Each cycle is
   * returned once, as the entity ids along the loop, rotated to start at its smallest id. Targets
   * outside the graph are ignored.
   */
  public List<List<UUID>> findCycles() {
    Set<List<UUID>> cycles = new LinkedHashSet<>();
    Set<UUID> finished = new HashSet<>();
    List<UUID> path = new ArrayList<>();
    Map<UUID, Integer> pathIndex = new HashMap<>();
    Deque<Iterator<UUID>> stack = new ArrayDeque<>();

    List<UUID> starts = new ArrayList<>(byEntityId.keySet());
    starts.sort(ID_ORDER);
    for (UUID start : starts) {
      if (finished.contains(start)) {
        continue;
      }
      enter(start, path, pathIndex, stack);
      while (!stack.isEmpty()) {
        Iterator<UUID> successors = stack.peek();
        if (successors.hasNext()) {
          UUID next = successors.next();
          Integer onPath = pathIndex.get(next);
          if (onPath != null) {
            cycles.add(normalize(path.subList(onPath, path.size())));
          } else if (!finished.contains(next)) {
            enter(next, path, pathIndex, stack);
          }
        } else {
          stack.pop();
          UUID done = path.remove(path.size() - 1);
          pathIndex.remove(done);
          finished.add(done);
        }
      }
    }
    return List.copyOf(cycles);
  }

  private void enter(
      UUID entityId,
      List<UUID> path,
      Map<UUID, Integer> pathIndex,
      Deque<Iterator<UUID>> stack) {
    pathIndex.put(entityId, path.size());
    path.add(entityId);
    stack.push(requiresSuccessors(entityId).iterator());
  }

  private Collection<UUID> requiresSuccessors(UUID entityId) {
    RuleGraphNode node = byEntityId.get(entityId);
    Set<UUID> successors = new TreeSet<>(ID_ORDER);
    for (Rule rule : node.rules()) {
      if (rule instanceof Rule.Requires requires) {
        for (UUID target : requires.targets()) {
          if (byEntityId.containsKey(target)) {
            successors.add(target);
          }
        }
      }
    }
    return successors;
  }

  private static List<UUID> normalize(List<UUID> loop) {
    int smallest = 0;
    for (int i = 1; i < loop.size(); i++) {
      if (ID_ORDER.compare(loop.get(i), loop.get(smallest)) < 0) {
        smallest = i;
      }
    }
    List<UUID> rotated = new ArrayList<>(loop.size());
    for (int i = 0; i < loop.size(); i++) {
      rotated.add(loop.get((smallest + i) % loop.size()));
    }
    return List.copyOf(rotated);
  }

  private static Map<UUID, List<IncompatibleEdge>> buildIncompatibleIndex(
      Collection<RuleGraphNode> nodes) {
    Map<UUID, List<IncompatibleEdge>> declared = new HashMap<>();
    Map<UUID, List<IncompatibleEdge>> reverse = new HashMap<>();
    for (RuleGraphNode node : nodes) {
      List<Rule> rules = node.rules();
      for (int i = 0; i < rules.size(); i++) {
        if (rules.get(i) instanceof Rule.IncompatibleWith incompatible) {
          for (UUID target : incompatible.targets()) {
            var edge =
                new IncompatibleEdge(node.versionId(), node.entityId(), i, target, incompatible);
            declared.computeIfAbsent(node.entityId(), k -> new ArrayList<>()).add(edge);
            if (!target.equals(node.entityId())) {
              reverse.computeIfAbsent(target, k -> new ArrayList<>()).add(edge);
            }
          }
        }
      }
    }
    Map<UUID, List<IncompatibleEdge>> index = new HashMap<>();
    Set<UUID> keys = new LinkedHashSet<>(declared.keySet());
    keys.addAll(reverse.keySet());
    for (UUID key : keys) {
      List<IncompatibleEdge> edges = new ArrayList<>(declared.getOrDefault(key, List.of()));
      edges.addAll(reverse.getOrDefault(key, List.of()));
      index.put(key, List.copyOf(edges));
    }
    return Collections.unmodifiableMap(index);
  }
}
