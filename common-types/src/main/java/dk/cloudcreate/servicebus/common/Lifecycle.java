package dk.cloudcreate.servicebus.common;

/**
 * Life cycle of components that own background resources, such as threads
 */
public interface Lifecycle {
    /**
     * Start the component. Calling {@link #start()} on an already started component
     * (where {@link #isStarted()} returns true) is ignored
     */
    void start();

    /**
     * Stop the component and release the resources it owns. Calling {@link #stop()} on an already
     * stopped component (where {@link #isStarted()} returns false) is ignored
     */
    void stop();

    /**
     * @return true if the component is started otherwise false
     */
    boolean isStarted();
}
