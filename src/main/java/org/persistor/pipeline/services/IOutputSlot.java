package org.persistor.pipeline.services;

/**
 * Host-provided output binding of the push variant. Whatever is set becomes the content of
 * one blob written by the host.
 */
public interface IOutputSlot {

    /**
     * @param content the newline-joined serialized records
     */
    void set(String content);
}
