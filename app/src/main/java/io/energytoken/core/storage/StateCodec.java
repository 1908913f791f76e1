package io.energytoken.core.storage;

import io.energytoken.core.config.LedgerConfig;
import io.energytoken.core.protocol.MintRecord;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed binary layouts for values kept in RocksDB. All integers big-endian.
 *  - long       : 8 bytes
 *  - MintRecord : cumulativeMinted(8) || lastMintHeight(8)
 *  - history    : count(4) || proofId(8) * count
 *  - config     : version(8) || paused(1) || owner || attester || registry || feeRecipient
 *                 (strings as len(4) || utf-8)
 */
final class StateCodec {
    private StateCodec(){}

    static byte[] longToBytes(long v) {
        ByteBuffer b = ByteBuffer.allocate(8);
        b.putLong(v);
        return b.array();
    }

    static long bytesToLong(byte[] a) {
        if (a == null || a.length != 8) {
            throw new IllegalArgumentException("Bad long encoding");
        }
        return ByteBuffer.wrap(a).getLong();
    }

    static byte[] stringKey(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    static String keyToString(byte[] key) {
        return new String(key, StandardCharsets.UTF_8);
    }

    static byte[] encodeRecord(MintRecord record) {
        ByteBuffer b = ByteBuffer.allocate(16);
        b.putLong(record.cumulativeMinted());
        b.putLong(record.lastMintHeight());
        return b.array();
    }

    static MintRecord decodeRecord(byte[] bytes) {
        try {
            ByteBuffer b = ByteBuffer.wrap(bytes);
            return new MintRecord(b.getLong(), b.getLong());
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed MintRecord bytes", ex);
        }
    }

    static byte[] encodeHistory(List<Long> history) {
        ByteBuffer b = ByteBuffer.allocate(4 + 8 * history.size());
        b.putInt(history.size());
        for (Long id : history) b.putLong(id);
        return b.array();
    }

    static List<Long> decodeHistory(byte[] bytes) {
        try {
            ByteBuffer b = ByteBuffer.wrap(bytes);
            int n = b.getInt();
            if (n < 0 || n * 8L != b.remaining()) {
                throw new IllegalArgumentException("Bad history length: " + n);
            }
            List<Long> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) out.add(b.getLong());
            return List.copyOf(out);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed history bytes", ex);
        }
    }

    static byte[] encodeConfig(LedgerConfig c) {
        byte[] owner = stringKey(c.owner());
        byte[] attester = stringKey(c.attester());
        byte[] registry = stringKey(c.registry());
        byte[] fee = stringKey(c.feeRecipient());
        ByteBuffer b = ByteBuffer.allocate(8 + 1 + 16 + owner.length + attester.length + registry.length + fee.length);
        b.putLong(c.version());
        b.put((byte) (c.paused() ? 1 : 0));
        putBytes(b, owner);
        putBytes(b, attester);
        putBytes(b, registry);
        putBytes(b, fee);
        return b.array();
    }

    static LedgerConfig decodeConfig(byte[] bytes) {
        try {
            ByteBuffer b = ByteBuffer.wrap(bytes);
            long version = b.getLong();
            boolean paused = b.get() != 0;
            String owner = readString(b);
            String attester = readString(b);
            String registry = readString(b);
            String fee = readString(b);
            return new LedgerConfig(owner, paused, attester, registry, fee, version);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed LedgerConfig bytes", ex);
        }
    }

    private static void putBytes(ByteBuffer buf, byte[] b) {
        buf.putInt(b.length);
        buf.put(b);
    }

    private static String readString(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + b.remaining() + ")");
        }
        byte[] out = new byte[len];
        b.get(out);
        return new String(out, StandardCharsets.UTF_8);
    }
}
