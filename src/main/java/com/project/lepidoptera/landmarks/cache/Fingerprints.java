package com.project.lepidoptera.landmarks.cache;

import com.project.lepidoptera.landmarks.imaging.BinaryMask;
import com.project.lepidoptera.landmarks.imaging.RgbImage;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** Deterministic SHA-1 fingerprints of pipeline inputs, used as cache keys. */
public final class Fingerprints {

    private Fingerprints() {}

    public static String of(RgbImage image, int topRuler) {
        MessageDigest md = sha1();
        md.update(ints(image.width(), image.height(), topRuler));
        for (int ch = 0; ch < 3; ch++) {
            double[] values = image.channel(ch);
            ByteBuffer buf = ByteBuffer.allocate(values.length * Double.BYTES);
            for (double v : values) buf.putDouble(v);
            md.update(buf.array());
        }
        return hex(md.digest());
    }

    public static String of(BinaryMask mask) {
        MessageDigest md = sha1();
        md.update(ints(mask.width(), mask.height()));
        boolean[] cells = mask.toArray();
        byte[] packed = new byte[(cells.length + 7) / 8];
        for (int i = 0; i < cells.length; i++) {
            if (cells[i]) packed[i >> 3] |= (byte) (1 << (i & 7));
        }
        md.update(packed);
        return hex(md.digest());
    }

    private static byte[] ints(int... values) {
        ByteBuffer buf = ByteBuffer.allocate(values.length * Integer.BYTES);
        for (int v : values) buf.putInt(v);
        return buf.array();
    }

    private static MessageDigest sha1() {
        try {
            return MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    private static String hex(byte[] hash) {
        StringBuilder hexString = new StringBuilder();
        for (byte b : hash) {
            hexString.append(String.format("%02x", b));
        }
        return hexString.toString();
    }
}
