package mytypist.cache.infrastructure.executor;

import java.util.Objects;

/**
 * Structured task name for the executor's logs.
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * TaskContext.of("CacheService", "Get", "mytypist:user:1") -> "CacheService:Get:mytypist:user:1"
 * TaskContext.of("CacheService", "Init")                   -> "CacheService:Init"
 * </pre>
 *
 * <p>{@code component} and {@code operation} are a fixed taxonomy; {@code dynamicValue} (usually a
 * key) only appears in logs.
 *
 * @param component component name, e.g. "CacheService", "RedisStore"
 * @param operation operation name, e.g. "Get", "SetAll"
 * @param dynamicValue per-call detail such as a key or tag
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  /** @return "component:operation[:dynamicValue]" */
  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
