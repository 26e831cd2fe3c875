package com.work.orchestrator.blockchain;

import org.web3j.utils.Numeric;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * 定长 32 字节值（batchId 以明文写上链）。
 */
public final class Bytes32 {

    public static final int LENGTH = 32;

    private static final Pattern HEX_PATTERN = Pattern.compile("^[0-9a-fA-F]{64}$");

    private final byte[] value;

    private Bytes32(byte[] value) {
        this.value = value;
    }

    public static Bytes32 of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Bytes32 requires exactly 32 bytes, got "
                    + (bytes == null ? "null" : String.valueOf(bytes.length)));
        }
        return new Bytes32(bytes.clone());
    }

    /**
     * 支持带或不带 0x 前缀的 64 位 hex。
     */
    public static Bytes32 fromHex(String hex) {
        if (hex == null || !HEX_PATTERN.matcher(Numeric.cleanHexPrefix(hex.trim())).matches()) {
            throw new IllegalArgumentException("Bytes32 requires 64 hex characters: " + hex);
        }
        return new Bytes32(Numeric.hexStringToByteArray(hex.trim()));
    }

    public byte[] toBytes() {
        return value.clone();
    }

    public String toHex() {
        return Numeric.toHexString(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bytes32)) return false;
        return Arrays.equals(value, ((Bytes32) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
