package mytypist.cache.infrastructure.redis;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import mytypist.cache.core.domain.model.RemoteEntry;
import mytypist.cache.core.port.out.RemoteStore;

/** L1-only mode: every read misses and every write is dropped. */
public class DisabledRemoteStore implements RemoteStore {

  @Override
  public Optional<RemoteEntry> get(String key) {
    return Optional.empty();
  }

  @Override
  public Map<String, RemoteEntry> getAll(Collection<String> keys) {
    return Map.of();
  }

  @Override
  public void set(String key, byte[] value, Duration ttl) {}

  @Override
  public void setAll(Map<String, byte[]> entries, Duration ttl) {}

  @Override
  public Set<String> delete(Collection<String> keys) {
    return Set.of();
  }

  @Override
  public void addToSet(String setKey, String member) {}

  @Override
  public Set<String> setMembers(String setKey) {
    return Set.of();
  }

  @Override
  public void expire(String key, Duration ttl) {}

  @Override
  public Set<String> drainSet(String setKey) {
    return Set.of();
  }

  @Override
  public boolean ping() {
    return false;
  }

  @Override
  public boolean isEnabled() {
    return false;
  }
}
