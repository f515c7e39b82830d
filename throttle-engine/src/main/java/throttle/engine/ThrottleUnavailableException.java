package throttle.engine;

/**
 * Thrown when a check reaches a module that is not loaded or a store that has been released.
 * Hosts can tell this apart from invariant violations and report it as a temporary outage.
 */
public final class ThrottleUnavailableException extends IllegalStateException {

    public ThrottleUnavailableException(String message) {
        super(message);
    }
}
