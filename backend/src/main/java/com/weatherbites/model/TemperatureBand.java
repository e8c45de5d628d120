package com.weatherbites.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed temperature bands in degrees Fahrenheit.
 * <p>
 * Each band covers {@code [lowerBound, next band's lowerBound)}; the first band is open
 * below and the last open above, so every non-NaN reading lands in exactly one band.
 */
public enum TemperatureBand {

    FREEZING("<30", Double.NEGATIVE_INFINITY,
        List.of("1369 Coffee House (hot chocolate)", "Soup Shack"),
        List.of("Hot Chocolate", "Tomato Soup", "Grilled Cheese"),
        "Peppermint Mocha"),

    COLD("31-45", 30,
        List.of("1369 Coffee House", "Tatte"),
        List.of("Chai Latte", "Almond Croissant", "Apple Cider Donut"),
        "Pumpkin Spice Latte"),

    COOL("46-60", 46,
        List.of("Blank Street Coffee", "Pavement Coffeehouse"),
        List.of("Cold Brew", "Blueberry Muffin", "Avocado Toast"),
        "Maple Oat Latte"),

    MILD("61-75", 61,
        List.of("Boba Tea and Snow Ice House", "Tiger Sugar"),
        List.of("Brown Sugar Boba", "Mango Snow Ice", "Taro Milk Tea"),
        "Strawberry Matcha Latte"),

    WARM("76-85", 76,
        List.of("Levain", "Fomu"),
        List.of("Chocolate Chip Walnut Cookie", "Vegan Soft Serve", "Lemon Bar"),
        "Peach Iced Tea"),

    HOT(">85", 86,
        List.of("JP Licks", "Kyo Matcha"),
        List.of("Cookie Dough Ice Cream", "Matcha Soft Serve", "Frozen Yogurt"),
        "Iced Matcha Lemonade");

    private static final TemperatureBand[] ASCENDING = values();

    private static final Set<String> ALL_LOCATIONS = collectLocations();

    private final String label;
    private final double lowerBound;
    private final List<String> locations;
    private final List<String> snacks;
    private final String seasonalSnack;

    TemperatureBand(String label, double lowerBound, List<String> locations,
                    List<String> snacks, String seasonalSnack) {
        this.label = label;
        this.lowerBound = lowerBound;
        this.locations = locations;
        this.snacks = snacks;
        this.seasonalSnack = seasonalSnack;
    }

    /**
     * Band containing the given Fahrenheit reading. Callers must reject NaN first.
     */
    public static TemperatureBand of(double fahrenheit) {
        TemperatureBand match = FREEZING;
        for (TemperatureBand band : ASCENDING) {
            if (fahrenheit >= band.lowerBound) {
                match = band;
            }
        }
        return match;
    }

    private static Set<String> collectLocations() {
        Set<String> locations = new LinkedHashSet<>();
        for (TemperatureBand band : ASCENDING) {
            locations.addAll(band.locations);
        }
        return Collections.unmodifiableSet(locations);
    }

    /**
     * Every location any band can recommend, in band order. This is also the allow-list
     * for review locations.
     */
    public static Set<String> allLocations() {
        return ALL_LOCATIONS;
    }

    public String getLabel() {
        return label;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public List<String> getLocations() {
        return locations;
    }

    public List<String> getSnacks() {
        return snacks;
    }

    public String getSeasonalSnack() {
        return seasonalSnack;
    }
}
