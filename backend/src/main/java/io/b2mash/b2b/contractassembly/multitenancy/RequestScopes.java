package io.b2mash.b2b.contractassembly.multitenancy;

import io.b2mash.b2b.contractassembly.exception.MissingTenantContextException;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Request-scoped tenant and actor identity. Bound by {@link TenantFilter} from headers supplied by
 * the tenant-isolation layer in front of this service, read by services and the audit builder.
 *
 * <p>The core never derives tenant scoping itself; it only stamps what the caller bound here.
 * Bindings are restored to the previous value when the binding lambda exits.
 */
public final class RequestScopes {

  public static final String ROLE_ADMIN = "admin";

  private static final ThreadLocal<Scope> CURRENT = new ThreadLocal<>();

  /**
   * Identity bound for the duration of one request or one internal unit of work.
   *
   * @param tenantId tenant the caller acts within
   * @param actorId acting user, null for system work
   * @param actorRole role of the acting user ("admin", "editor", "user"), may be null
   */
  public record Scope(String tenantId, UUID actorId, String actorRole) {}

  /** Runs the given action with the scope bound, restoring any previous binding afterwards. */
  public static void run(Scope scope, Runnable action) {
    call(
        scope,
        () -> {
          action.run();
          return null;
        });
  }

  /** Calls the given supplier with the scope bound, restoring any previous binding afterwards. */
  public static <T> T call(Scope scope, Supplier<T> action) {
    Scope previous = CURRENT.get();
    CURRENT.set(scope);
    try {
      return action.get();
    } finally {
      if (previous == null) {
        CURRENT.remove();
      } else {
        CURRENT.set(previous);
      }
    }
  }

  /** Returns the tenant id. Throws if the filter chain did not bind one. */
  public static String requireTenantId() {
    var scope = CURRENT.get();
    if (scope == null || scope.tenantId() == null) {
      throw new MissingTenantContextException();
    }
    return scope.tenantId();
  }

  /** Returns the tenant id, or null if not bound. */
  public static String getTenantIdOrNull() {
    var scope = CURRENT.get();
    return scope != null ? scope.tenantId() : null;
  }

  /** Returns the acting user's id. Throws if the request carries no actor. */
  public static UUID requireActorId() {
    var actorId = getActorIdOrNull();
    if (actorId == null) {
      throw new MissingTenantContextException("Request carries no acting user");
    }
    return actorId;
  }

  /** Returns the acting user's id, or null if not bound. */
  public static UUID getActorIdOrNull() {
    var scope = CURRENT.get();
    return scope != null ? scope.actorId() : null;
  }

  /** Returns the acting user's role, or null if not bound. */
  public static String getActorRole() {
    var scope = CURRENT.get();
    return scope != null ? scope.actorRole() : null;
  }

  public static boolean isAdmin() {
    return ROLE_ADMIN.equalsIgnoreCase(getActorRole());
  }

  private RequestScopes() {}
}
