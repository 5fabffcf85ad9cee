package org.persistor.pipeline.api.resources;

/**
 * Base interface for all resources of the persistor.
 * <p>
 * Resources are components that provide access to external systems, such as
 * message sources or blob stores. This interface serves as a common type for all
 * resource implementations so that they can be wired and monitored uniformly.
 */
public interface IResource {

    /**
     * The operational state of a resource.
     */
    enum ResourceState {
        /**
         * The resource is functioning normally.
         */
        ACTIVE,
        /**
         * The resource is temporarily idle (e.g., source drained).
         */
        WAITING,
        /**
         * The resource has encountered an error.
         */
        FAILED
    }

    /**
     * Returns the configured name of this resource instance.
     *
     * @return The resource name.
     */
    String getResourceName();

    /**
     * Returns the current state of the resource.
     *
     * @return The current {@link ResourceState}.
     */
    ResourceState getState();
}
