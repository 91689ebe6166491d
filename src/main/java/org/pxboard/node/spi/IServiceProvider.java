package org.pxboard.node.spi;

/**
 * A process that offers a service to the processes that {@code require} it.
 */
public interface IServiceProvider {

    /**
     * @return The service handed to dependent processes, or null if there is none.
     */
    Object getExposedService();
}
