package com.tapmap.fountains.domain.policy;

/**
 * Standard base-32 geohash encoding. Used when a fountain's coordinates are set;
 * query paths only read the stored hash, or check a caller's prefix against the alphabet.
 */
public final class GeohashEncoder {

    private static final String BASE32 = "0123456789bcdefghjkmnpqrstuvwxyz";
    private static final int BITS_PER_CHAR = 5;

    private GeohashEncoder() {
    }

    /**
     * True when the value is a non-empty geohash of at most {@code maxLength}
     * lowercase base-32 characters.
     */
    public static boolean isValidPrefix(String value, int maxLength) {
        if (value == null || value.isEmpty() || value.length() > maxLength) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (BASE32.indexOf(value.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Encode latitude/longitude to a geohash of the given length.
     *
     * @param latitude  Latitude (-90 to 90)
     * @param longitude Longitude (-180 to 180)
     * @param precision Number of characters (1 to 12)
     */
    public static String encode(double latitude, double longitude, int precision) {
        if (latitude < -90 || latitude > 90 || Double.isNaN(latitude)) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90");
        }
        if (longitude < -180 || longitude > 180 || Double.isNaN(longitude)) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180");
        }
        if (precision < 1 || precision > 12) {
            throw new IllegalArgumentException("Geohash precision must be between 1 and 12");
        }

        double latLow = -90.0;
        double latHigh = 90.0;
        double lngLow = -180.0;
        double lngHigh = 180.0;

        StringBuilder geohash = new StringBuilder(precision);
        boolean evenBit = true; // even bits refine longitude
        int bit = 0;
        int charIndex = 0;

        while (geohash.length() < precision) {
            if (evenBit) {
                double mid = (lngLow + lngHigh) / 2;
                if (longitude >= mid) {
                    charIndex = (charIndex << 1) | 1;
                    lngLow = mid;
                } else {
                    charIndex = charIndex << 1;
                    lngHigh = mid;
                }
            } else {
                double mid = (latLow + latHigh) / 2;
                if (latitude >= mid) {
                    charIndex = (charIndex << 1) | 1;
                    latLow = mid;
                } else {
                    charIndex = charIndex << 1;
                    latHigh = mid;
                }
            }
            evenBit = !evenBit;

            if (++bit == BITS_PER_CHAR) {
                geohash.append(BASE32.charAt(charIndex));
                bit = 0;
                charIndex = 0;
            }
        }
        return geohash.toString();
    }
}
