package com.groceryai.infrastructure.ai.extraction;

import com.groceryai.domain.extraction.model.ExtractedItem;

import java.util.Locale;
import java.util.Map;

/**
 * Maps unit spellings to canonical units. Unknown units pass through lowercased.
 */
public final class UnitNormalizer {

    private static final Map<String, String> SYNONYMS = Map.ofEntries(
            // weight
            Map.entry("kg", "kg"), Map.entry("kilogram", "kg"), Map.entry("kilograms", "kg"), Map.entry("kilo", "kg"),
            Map.entry("g", "g"), Map.entry("gram", "g"), Map.entry("grams", "g"),
            Map.entry("lb", "lb"), Map.entry("lbs", "lb"), Map.entry("pound", "lb"), Map.entry("pounds", "lb"),
            Map.entry("oz", "oz"), Map.entry("ounce", "oz"), Map.entry("ounces", "oz"),
            // volume
            Map.entry("l", "liter"), Map.entry("liter", "liter"), Map.entry("liters", "liter"),
            Map.entry("litre", "liter"), Map.entry("litres", "liter"),
            Map.entry("ml", "ml"), Map.entry("milliliter", "ml"), Map.entry("milliliters", "ml"),
            Map.entry("gal", "gallon"), Map.entry("gallon", "gallon"), Map.entry("gallons", "gallon"),
            // count
            Map.entry("pc", "piece"), Map.entry("pcs", "piece"), Map.entry("piece", "piece"), Map.entry("pieces", "piece"),
            Map.entry("unit", "piece"), Map.entry("units", "piece"), Map.entry("each", "piece"),
            Map.entry("dozen", "dozen"), Map.entry("doz", "dozen"),
            Map.entry("pack", "pack"), Map.entry("packs", "pack"), Map.entry("package", "pack"), Map.entry("packages", "pack"),
            Map.entry("bunch", "bunch"), Map.entry("bunches", "bunch"),
            Map.entry("bag", "bag"), Map.entry("bags", "bag"),
            Map.entry("bottle", "bottle"), Map.entry("bottles", "bottle"),
            Map.entry("can", "can"), Map.entry("cans", "can"),
            Map.entry("box", "box"), Map.entry("boxes", "box"),
            Map.entry("loaf", "loaf"), Map.entry("loaves", "loaf"),
            Map.entry("carton", "carton"), Map.entry("cartons", "carton")
    );

    private UnitNormalizer() {
    }

    public static String normalize(String unit) {
        if (unit == null || unit.isBlank()) {
            return ExtractedItem.DEFAULT_UNIT;
        }
        String key = unit.trim().toLowerCase(Locale.ROOT);
        return SYNONYMS.getOrDefault(key, key);
    }

    public static boolean isKnown(String unit) {
        return unit != null && SYNONYMS.containsKey(unit.trim().toLowerCase(Locale.ROOT));
    }
}
