package com.pinclick.copilot.util;

import com.pinclick.copilot.model.Coordinates;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Static gazetteer of Bangalore micro-locations plus great-circle distance helpers.
 */
public final class GeoUtils {

    public static final double EARTH_RADIUS_KM = 6371.0;

    public static final String ZONE_NORTH = "north bangalore";
    public static final String ZONE_SOUTH = "south bangalore";
    public static final String ZONE_EAST = "east bangalore";
    public static final String ZONE_WEST = "west bangalore";
    public static final String ZONE_CENTRAL = "central bangalore";

    private static final Pattern LOCALITY_SEPARATORS =
            Pattern.compile("\\s*(?:,|/|&|\\bor\\b|\\band\\b)\\s*", Pattern.CASE_INSENSITIVE);

    private record Place(Coordinates coordinates, String zone) {
    }

    // Insertion order matters: substring resolution returns the first hit.
    private static final Map<String, Place> GAZETTEER = new LinkedHashMap<>();

    static {
        add("whitefield", 12.9698, 77.7500, ZONE_EAST);
        add("sarjapur road", 12.9100, 77.6800, ZONE_EAST);
        add("sarjapur", 12.8600, 77.7800, ZONE_EAST);
        add("panathur", 12.9240, 77.7118, ZONE_EAST);
        add("marathahalli", 12.9591, 77.6974, ZONE_EAST);
        add("koramangala", 12.9352, 77.6245, ZONE_SOUTH);
        add("bellandur", 12.9304, 77.6784, ZONE_EAST);
        add("hebbal", 13.0354, 77.5988, ZONE_NORTH);
        add("devanahalli", 13.2484, 77.7137, ZONE_NORTH);
        add("yelahanka", 13.1007, 77.5963, ZONE_NORTH);
        add("bagalur", 13.1332, 77.6685, ZONE_NORTH);
        add("thanisandra", 13.0582, 77.6333, ZONE_NORTH);
        add("hennur", 13.0258, 77.6305, ZONE_NORTH);
        add("budigere cross", 13.0560, 77.7470, ZONE_EAST);
        add("marathahalli bridge", 12.9562, 77.7011, ZONE_EAST);
        add("jayanagar", 12.9290, 77.5829, ZONE_SOUTH);
        add("hsr layout", 12.9121, 77.6446, ZONE_SOUTH);
        add("electronic city", 12.8452, 77.6632, ZONE_SOUTH);
        add("bannerghatta road", 12.8900, 77.5900, ZONE_SOUTH);
        add("kalyan nagar", 13.0221, 77.6403, ZONE_NORTH);
        add("kammanahalli", 13.0150, 77.6370, ZONE_NORTH);
        add("brookefield", 12.9650, 77.7180, ZONE_EAST);
        add("hopefarm", 12.9840, 77.7510, ZONE_EAST);
        add("kadugodi", 12.9980, 77.7610, ZONE_EAST);
        add("varthur", 12.9400, 77.7460, ZONE_EAST);
        add("gunjur", 12.9150, 77.7350, ZONE_EAST);
        add("domlur", 12.9609, 77.6387, ZONE_CENTRAL);
        add("indiranagar", 12.9784, 77.6408, ZONE_CENTRAL);
        add("frazer town", 13.0000, 77.6100, ZONE_CENTRAL);
        add("rt nagar", 13.0180, 77.5930, ZONE_NORTH);
        add("sahakar nagar", 13.0600, 77.5850, ZONE_NORTH);
        add(ZONE_NORTH, 13.0500, 77.6000, ZONE_NORTH);
        add(ZONE_SOUTH, 12.8800, 77.6000, ZONE_SOUTH);
        add(ZONE_EAST, 12.9600, 77.7200, ZONE_EAST);
        add(ZONE_WEST, 12.9800, 77.5200, ZONE_WEST);
        add(ZONE_CENTRAL, 12.9716, 77.5946, ZONE_CENTRAL);
        add("bangalore", 12.9716, 77.5946, null);
    }

    private GeoUtils() {
    }

    private static void add(String name, double lat, double lon, String zone) {
        GAZETTEER.put(name, new Place(new Coordinates(lat, lon), zone));
    }

    /**
     * Haversine distance in kilometres.
     */
    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static double distanceKm(Coordinates from, Coordinates to) {
        return distanceKm(from.latitude(), from.longitude(), to.latitude(), to.longitude());
    }

    /**
     * Resolves a location name to coordinates: exact gazetteer name first, then substring
     * containment in either direction.
     */
    public static Optional<Coordinates> resolve(String locationName) {
        return resolveKey(locationName, true).map(key -> GAZETTEER.get(key).coordinates());
    }

    /**
     * Broad zone a location belongs to, or the zone itself when the name is a zone. Only
     * gazetteer names contained in the input count, so "Bangalore" alone has no zone.
     */
    public static Optional<String> zoneOf(String locationName) {
        return resolveKey(locationName, false).map(key -> GAZETTEER.get(key).zone());
    }

    /**
     * Splits a buyer-supplied locality such as "Hebbal or Whitefield" into its named parts,
     * preserving the original case.
     */
    public static List<String> localityParts(String locality) {
        List<String> parts = new ArrayList<>();
        if (!StringUtils.hasText(locality)) {
            return parts;
        }
        for (String part : LOCALITY_SEPARATORS.split(locality.trim())) {
            if (!part.isBlank()) {
                parts.add(part.trim());
            }
        }
        return parts;
    }

    public static boolean isZone(String locationName) {
        if (!StringUtils.hasText(locationName)) {
            return false;
        }
        String key = locationName.trim().toLowerCase(Locale.ROOT);
        return key.equals(ZONE_NORTH) || key.equals(ZONE_SOUTH) || key.equals(ZONE_EAST)
                || key.equals(ZONE_WEST) || key.equals(ZONE_CENTRAL);
    }

    private static Optional<String> resolveKey(String locationName, boolean eitherDirection) {
        if (!StringUtils.hasText(locationName)) {
            return Optional.empty();
        }
        String name = locationName.trim().toLowerCase(Locale.ROOT);
        if (GAZETTEER.containsKey(name)) {
            return Optional.of(name);
        }
        for (String key : GAZETTEER.keySet()) {
            if (name.contains(key) || (eitherDirection && key.contains(name))) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}
