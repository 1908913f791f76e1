package io.energytoken.core.protocol;

public final class Address {
    private Address(){}

    public static boolean isValid(String addr) {
        if (addr == null) return false;
        int len = addr.length();
        if (len < ProtocolLimits.MIN_ADDRESS_LEN || len > ProtocolLimits.MAX_ADDRESS_LEN) return false;
        // principal charset: standard ("ST1...") and contract ("ST1....name") forms
        for (int i = 0; i < len; i++) {
            char c = addr.charAt(i);
            boolean ok = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                    || c == '_' || c == '-' || c == ':' || c == '.';
            if (!ok) return false;
        }
        return true;
    }
}
