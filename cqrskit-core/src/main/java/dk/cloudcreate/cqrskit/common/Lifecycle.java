package dk.cloudcreate.cqrskit.common;

/**
 * Life cycle of a long running background component, such as an event handling processor
 */
public interface Lifecycle {
    /**
     * Start the processing. Calling {@link #start()} on a component that is already started
     * (where {@link #isStarted()} returns true) is ignored
     */
    void start();

    /**
     * Request the processing to stop. Calling {@link #stop()} on a component that isn't started
     * (where {@link #isStarted()} returns false) is ignored
     */
    void stop();

    /**
     * @return true if the component is started otherwise false
     */
    boolean isStarted();
}
