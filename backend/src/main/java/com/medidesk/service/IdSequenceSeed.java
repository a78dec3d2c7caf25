package com.medidesk.service;

/**
 * Source of the highest sequence number already stored for an id bucket.
 */
public interface IdSequenceSeed {

    /**
     * @return the highest sequence issued for {@code prefix + stamp}, or 0 if none
     */
    long highestIssued(String prefix, String stamp);
}
