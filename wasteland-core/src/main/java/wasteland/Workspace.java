package wasteland;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The clients of one rig, one per joined upstream commons.
 */
public final class Workspace {
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, WastelandClient> clients = new HashMap<>();
  private final Map<String, UpstreamInfo> infos = new HashMap<>();
  private final String rigHandle;

  public Workspace(String rigHandle) {
    this.rigHandle = rigHandle;
  }

  public String rigHandle() {
    return rigHandle;
  }

  /**
   * Registers the client of an upstream, replacing any previous one.
   */
  public void add(UpstreamInfo info, WastelandClient client) {
    lock.writeLock().lock();
    try {
      clients.put(info.upstream(), client);
      infos.put(info.upstream(), info);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void remove(String upstream) {
    lock.writeLock().lock();
    try {
      clients.remove(upstream);
      infos.remove(upstream);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * @throws IllegalArgumentException if no client is registered for {@code upstream}
   */
  public WastelandClient client(String upstream) {
    lock.readLock().lock();
    try {
      WastelandClient client = clients.get(upstream);
      if (client == null) {
        throw new IllegalArgumentException("no client for upstream \"" + upstream + "\"");
      }
      return client;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns the registered upstreams sorted by name.
   */
  public List<UpstreamInfo> upstreams() {
    lock.readLock().lock();
    try {
      List<UpstreamInfo> result = new ArrayList<>(infos.values());
      result.sort(Comparator.comparing(UpstreamInfo::upstream));
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }
}
