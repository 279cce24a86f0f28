package com.dns.cache.core.model;

import com.dns.cache.core.InvalidRecordException;

/**
 * Address record types the cache can hold.
 */
public enum RecordType {
    A(1, 4),
    AAAA(28, 16);

    private final int code;
    private final int addressLength;

    RecordType(int code, int addressLength) {
        this.code = code;
        this.addressLength = addressLength;
    }

    /**
     * Returns the DNS wire type code (1 for A, 28 for AAAA).
     */
    public int getCode() {
        return code;
    }

    /**
     * Returns the exact number of address bytes a record of this type carries.
     */
    public int getAddressLength() {
        return addressLength;
    }

    /**
     * Maps a DNS wire type code to a record type.
     *
     * @param code the type code from a DNS question or answer
     * @return the matching record type
     * @throws InvalidRecordException if the code is not an address record type
     */
    public static RecordType fromCode(int code) {
        for (RecordType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new InvalidRecordException("Unsupported record type code: " + code);
    }
}
