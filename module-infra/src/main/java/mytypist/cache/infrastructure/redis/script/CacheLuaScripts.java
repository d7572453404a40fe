package mytypist.cache.infrastructure.redis.script;

/** Lua scripts run by {@code RedissonRemoteStore}. All of them touch a single key. */
public final class CacheLuaScripts {

  /**
   * KEYS[1] = key, ARGV[1] = ttl millis. Returns 1 when the deadline moved.
   *
   * <p>PTTL -2: key gone, nothing to do. PTTL -1: no deadline yet (fresh SADD), set one.
   */
  public static final String EXTEND_TTL =
      """
      local current = redis.call('PTTL', KEYS[1])
      if current == -2 then
        return 0
      end
      local ttl = tonumber(ARGV[1])
      if current == -1 or current < ttl then
        redis.call('PEXPIRE', KEYS[1], ttl)
        return 1
      end
      return 0
      """;

  /** KEYS[1] = set key. SMEMBERS then DEL in one step; returns the members. */
  public static final String DRAIN_SET =
      """
      local members = redis.call('SMEMBERS', KEYS[1])
      if #members > 0 then
        redis.call('DEL', KEYS[1])
      end
      return members
      """;

  public static final String PING = "return redis.call('PING')";

  private CacheLuaScripts() {}
}
