package com.ledgerlens.backend.services.imports.description;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Curated merchant alias tables. Order matters: the first entry with a matching alias wins,
 * so longer names ("Swiggy Instamart") sit before their prefixes ("Swiggy").
 */
public final class KnownMerchants {

    public static final KnownMerchants GENERIC = new KnownMerchants(table(
            "Swiggy Instamart", List.of("swiggy instamart", "instamart"),
            "Swiggy", List.of("swiggy"),
            "Zomato", List.of("zomato", "zomatofo"),
            "Uber", List.of("uber", "uber india"),
            "Ola", List.of("ola", "olacabs"),
            "Rapido", List.of("rapido"),
            "Blinkit", List.of("blinkit", "grofers"),
            "Zepto", List.of("zepto"),
            "BigBasket", List.of("bigbasket", "big basket"),
            "Amazon", List.of("amazon", "amzn"),
            "Flipkart", List.of("flipkart"),
            "Myntra", List.of("myntra"),
            "Ajio", List.of("ajio"),
            "Netflix", List.of("netflix"),
            "Spotify", List.of("spotify"),
            "Youtube", List.of("youtube", "google oct"),
            "Apple", List.of("apple.com", "itunes"),
            "Google", List.of("google"),
            "Jio", List.of("jio", "reliance jio"),
            "Airtel", List.of("airtel"),
            "Vodafone", List.of("vi", "vodafone"),
            "Mcdonalds", List.of("mcdonalds", "mcdonald"),
            "Starbucks", List.of("starbucks"),
            "KFC", List.of("kfc"),
            "Burger King", List.of("burger king"),
            "Domino's", List.of("dominos", "domino's"),
            "Pizza Hut", List.of("pizza hut"),
            "Subway", List.of("subway")
    ));

    // SBI truncates fields to fixed widths, hence the squashed and partial aliases
    public static final KnownMerchants SBI = new KnownMerchants(table(
            "Swiggy Instamart", List.of("swiggy instamart", "instamart"),
            "Swiggy", List.of("swiggy"),
            "Zomato", List.of("zomato", "zomatofo", "payzomato", "zomatofood", "zomato-ord"),
            "Uber", List.of("uber"),
            "Ola", List.of("ola", "olacabs", "olamon"),
            "Rapido", List.of("rapido"),
            "Blinkit", List.of("blinkit"),
            "Zepto", List.of("zepto", "zeptonow"),
            "BigBasket", List.of("bigbasket"),
            "Amazon", List.of("amazon", "amzn", "amazonpay"),
            "Flipkart", List.of("flipkart"),
            "Myntra", List.of("myntra"),
            "Netflix", List.of("netflix"),
            "Spotify", List.of("spotify"),
            "YouTube", List.of("youtube", "google"),
            "Jio", List.of("jio", "reliance"),
            "Airtel", List.of("airtel"),
            "PhonePe", List.of("phonepe", "phonpe"),
            "Paytm", List.of("paytm", "one97communica", "one97"),
            "Google Pay", List.of("googlepay", "gpay"),
            "CRED", List.of("cred"),
            "Dunzo", List.of("dunzo"),
            "Dream11", List.of("dream11"),
            "Groww", List.of("groww"),
            "Zerodha", List.of("zerodha"),
            "Slice", List.of("slice"),
            "Meesho", List.of("meesho"),
            "Nykaa", List.of("nykaa"),
            "BookMyShow", List.of("bookmyshow"),
            "IRCTC", List.of("irctc"),
            "MakeMyTrip", List.of("makemytrip"),
            "Ixigo", List.of("ixigo"),
            "BESCOM", List.of("bescom"),
            "Domino's", List.of("dominos", "domino"),
            "McDonald's", List.of("mcdonalds", "mcdonald"),
            "KFC", List.of("kfc"),
            "Starbucks", List.of("starbucks"),
            "Burger King", List.of("burgerking", "burger king")
    ));

    private final Map<String, List<String>> aliasesByName;

    private KnownMerchants(Map<String, List<String>> aliasesByName) {
        this.aliasesByName = aliasesByName;
    }

    /**
     * Substring match of any alias against the lowercased text.
     */
    public Optional<String> match(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        return matchLowercased(text.toLowerCase(Locale.ROOT));
    }

    /**
     * Joins the fields and matches twice: first with all whitespace removed (catches names split
     * across fixed-width columns), then space-joined.
     */
    public Optional<String> matchFields(String... fields) {
        String joined = String.join(" ", fields);
        Optional<String> squashed = matchLowercased(joined.replaceAll("\\s+", "").toLowerCase(Locale.ROOT));
        if (squashed.isPresent()) return squashed;
        return matchLowercased(joined.toLowerCase(Locale.ROOT));
    }

    private Optional<String> matchLowercased(String lower) {
        for (Map.Entry<String, List<String>> e : aliasesByName.entrySet()) {
            for (String alias : e.getValue()) {
                if (contains(lower, alias)) return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }

    // two-letter aliases ("vi") only count as whole words
    private static boolean contains(String lower, String alias) {
        if (alias.length() > 2) return lower.contains(alias);
        return Pattern.compile("\\b" + Pattern.quote(alias) + "\\b").matcher(lower).find();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, List<String>> table(Object... pairs) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (List<String>) pairs[i + 1]);
        }
        return map;
    }
}
