package org.pxboard.node.spi;

/**
 * A long-running part of a node whose lifecycle the {@link org.pxboard.node.Node} controls.
 */
public interface IProcess {

    /**
     * Starts the process. Must return once the process is serving; background work runs on
     * the process's own threads.
     */
    void start();

    /**
     * Stops the process and releases its resources.
     */
    void stop();
}
