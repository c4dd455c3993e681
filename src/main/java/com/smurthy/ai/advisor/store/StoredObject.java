package com.smurthy.ai.advisor.store;

/**
 * Raw object as listed from the document store.
 */
public record StoredObject(String id, byte[] rawBytes) {
}
