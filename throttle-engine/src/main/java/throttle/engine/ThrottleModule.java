package throttle.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference-counted owner of one shared {@link ThrottleEngine}.
 *
 * A host may load the limiter several times (for instance once per configuration
 * that uses it). The first {@link #onLoad()} allocates the store, later ones reuse it;
 * the store is torn down exactly once, when the last {@link #onUnload()} brings the
 * count back to zero. A later load starts again from an empty store.
 *
 * The module lock is separate from the partition locks and is never held while an
 * admission check runs.
 */
public final class ThrottleModule {

    private static final Logger log = LoggerFactory.getLogger(ThrottleModule.class);

    private final ThrottleConfig config;
    private final ReentrantLock lock = new ReentrantLock();

    private int refCount;
    private ThrottleEngine engine;

    public ThrottleModule(ThrottleConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * Process-wide module configured from system properties.
     */
    public static ThrottleModule global() {
        return GlobalHolder.INSTANCE;
    }

    /**
     * Registers one load.
     *
     * @return The shared engine
     */
    public ThrottleEngine onLoad() {
        lock.lock();
        try {
            if (refCount == 0) {
                engine = new ThrottleEngine(new PartitionStore(config));
                log.info("Throttle store allocated ({} partitions, gc every {} calls)",
                    config.partitions(), config.gcInterval());
            }
            refCount++;
            log.debug("Throttle module loaded, refCount={}", refCount);
            return engine;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases one load. The last release destroys every bucket.
     *
     * @throws IllegalStateException if there is no matching load
     */
    public void onUnload() {
        lock.lock();
        try {
            if (refCount == 0) {
                log.error("Throttle module unloaded without a matching load");
                throw new IllegalStateException("unload without matching load");
            }
            refCount--;
            log.debug("Throttle module unloaded, refCount={}", refCount);
            if (refCount == 0) {
                int dropped = engine.store().destroy();
                engine = null;
                log.info("Throttle store released, {} buckets dropped", dropped);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the shared engine.
     *
     * @throws ThrottleUnavailableException if the module is not loaded
     */
    public ThrottleEngine engine() {
        lock.lock();
        try {
            if (engine == null) {
                throw new ThrottleUnavailableException("throttle module is not loaded");
            }
            return engine;
        } finally {
            lock.unlock();
        }
    }

    public int refCount() {
        lock.lock();
        try {
            return refCount;
        } finally {
            lock.unlock();
        }
    }

    public boolean isLoaded() {
        return refCount() > 0;
    }

    private static final class GlobalHolder {
        private static final ThrottleModule INSTANCE =
            new ThrottleModule(ThrottleConfig.fromProperties(System.getProperties()));
    }
}
