package com.dns.cache.core.model;

import com.dns.cache.core.InvalidRecordException;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable address record as stored in the cache.
 *
 * <p>The address bytes are copied on the way in and on the way out, so a record
 * handed to several callers can never be changed by one of them.</p>
 */
public final class AddressRecord {

    /** Maximum domain length in UTF-8 bytes. */
    public static final int MAX_DOMAIN_LENGTH = 255;

    private final String domain;
    private final RecordType recordType;
    private final byte[] address;
    private final int ttlSeconds;

    private AddressRecord(String domain, RecordType recordType, byte[] address, int ttlSeconds) {
        this.domain = domain;
        this.recordType = recordType;
        this.address = address;
        this.ttlSeconds = ttlSeconds;
    }

    /**
     * Validates the given fields and creates a record.
     *
     * @param domain     the domain name, 1 to {@value #MAX_DOMAIN_LENGTH} UTF-8 bytes
     * @param recordType A or AAAA
     * @param address    raw address bytes, exactly {@link RecordType#getAddressLength()} long
     * @param ttlSeconds time-to-live as received from upstream, must not be negative
     * @throws InvalidRecordException if any field is out of bounds
     */
    public static AddressRecord of(String domain, RecordType recordType, byte[] address, int ttlSeconds) {
        validateDomain(domain);
        if (recordType == null) {
            throw new InvalidRecordException("Record type must not be null");
        }
        if (address == null) {
            throw new InvalidRecordException("Address must not be null");
        }
        if (address.length != recordType.getAddressLength()) {
            throw new InvalidRecordException(
                    "Address length " + address.length + " does not match record type " + recordType +
                            " (expected " + recordType.getAddressLength() + ")");
        }
        if (ttlSeconds < 0) {
            throw new InvalidRecordException("TTL must not be negative (was " + ttlSeconds + ")");
        }
        return new AddressRecord(domain, recordType, address.clone(), ttlSeconds);
    }

    /**
     * Checks a domain against the length bound. Syntax is the resolver's concern.
     *
     * @throws InvalidRecordException if the domain is null, empty or too long
     */
    public static void validateDomain(String domain) {
        if (domain == null || domain.isEmpty()) {
            throw new InvalidRecordException("Domain must not be null or empty");
        }
        int length = domain.getBytes(StandardCharsets.UTF_8).length;
        if (length > MAX_DOMAIN_LENGTH) {
            throw new InvalidRecordException(
                    "Domain exceeds maximum length of " + MAX_DOMAIN_LENGTH + " bytes (was " + length + ")");
        }
    }

    public String getDomain() {
        return domain;
    }

    public RecordType getRecordType() {
        return recordType;
    }

    /**
     * Returns a copy of the raw address bytes.
     */
    public byte[] getAddress() {
        return address.clone();
    }

    public int getTtlSeconds() {
        return ttlSeconds;
    }

    public CacheKey key() {
        return new CacheKey(domain, recordType);
    }

    /**
     * Converts the address to an {@link InetAddress} bound to the domain name.
     * No name service lookup takes place.
     */
    public InetAddress toInetAddress() {
        try {
            return InetAddress.getByAddress(domain, address.clone());
        } catch (UnknownHostException e) {
            // unreachable: the length was checked at construction
            throw new IllegalStateException("Invalid address length for " + recordType, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AddressRecord that = (AddressRecord) o;
        return ttlSeconds == that.ttlSeconds
                && domain.equals(that.domain)
                && recordType == that.recordType
                && Arrays.equals(address, that.address);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(domain, recordType, ttlSeconds);
        return 31 * result + Arrays.hashCode(address);
    }

    @Override
    public String toString() {
        return "AddressRecord{domain='" + domain + "', type=" + recordType +
                ", address=" + toInetAddress().getHostAddress() + ", ttl=" + ttlSeconds + "s}";
    }
}
