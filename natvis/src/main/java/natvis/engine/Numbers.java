package natvis.engine;

import natvis.NatvisConfig;

/**
 * Parsing of the number/address text debuggers show for values.
 */
class Numbers {
    private static final long MAX_UINT = 0xFFFFFFFFL;

    /**
     * Addresses look like "0x602010" or "0x602010 <some_symbol>"; decimal is accepted too.
     * @return the address, or 0 if `value` doesn't start with one
     */
    static long parseAddr(String value) {
        if (value == null) {
            return 0;
        }
        final var trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        final int space = indexOfWhitespace(trimmed);
        final var token = space < 0 ? trimmed : trimmed.substring(0, space);
        try {
            if (token.startsWith("0x") || token.startsWith("0X")) {
                return Long.parseUnsignedLong(token.substring(2), 16);
            }
            return Long.parseUnsignedLong(token);
        }
        catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * @return 0 if `value` isn't an unsigned 32 bit number
     */
    static long parseUint(String value) {
        try {
            return parseUintOrThrow(value);
        }
        catch (SizeParseException e) {
            return 0;
        }
    }

    static long parseUintOrThrow(String value) {
        if (value == null) {
            throw new SizeParseException("null");
        }
        final var trimmed = value.trim();
        try {
            final long v;
            if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
                v = Long.parseLong(trimmed.substring(2), 16);
            }
            else {
                v = Long.parseLong(trimmed);
            }
            if (v < 0 || v > MAX_UINT) {
                throw new SizeParseException(value);
            }
            return v;
        }
        catch (NumberFormatException e) {
            throw new SizeParseException(value);
        }
    }

    static int clampToMaxExpand(long size) {
        return (int)Math.min(size, NatvisConfig.MAX_EXPAND);
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); ++i) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
