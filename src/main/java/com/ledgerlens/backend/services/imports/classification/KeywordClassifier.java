package com.ledgerlens.backend.services.imports.classification;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.services.imports.CanonicalTransaction;

/**
 * Deterministic local classifier over description + merchant. Keywords of up to four letters
 * must match as whole words ("ola" should not hit "cola"), longer ones as substrings.
 */
@Component
public class KeywordClassifier implements Classifier {

    private static final Map<String, List<String>> CATEGORY_KEYWORDS = new LinkedHashMap<>();

    static {
        CATEGORY_KEYWORDS.put("Food", List.of(
                "swiggy", "zomato", "food", "restaurant", "dining", "blinkit", "zepto", "bigbasket",
                "grofers", "mcdonalds", "starbucks", "kfc", "burger king", "dominos", "pizza hut",
                "subway", "grocery", "groceries"));
        CATEGORY_KEYWORDS.put("Transport", List.of(
                "uber", "ola", "rapido", "taxi", "cab", "bus", "train", "metro", "fuel", "petrol",
                "diesel", "parking"));
        CATEGORY_KEYWORDS.put("Utilities", List.of(
                "electricity", "water", "gas", "airtel", "jio", "vodafone", "broadband", "wifi",
                "bescom", "bill", "recharge"));
        CATEGORY_KEYWORDS.put("Shopping", List.of(
                "amazon", "flipkart", "myntra", "ajio", "shopping", "clothing", "meesho"));
        CATEGORY_KEYWORDS.put("Entertainment", List.of(
                "netflix", "spotify", "youtube", "hotstar", "prime video", "movie", "cinema", "gaming",
                "xbox", "playstation"));
        CATEGORY_KEYWORDS.put("Health", List.of(
                "medical", "doctor", "pharmacy", "hospital", "gym", "apollo", "health"));
        CATEGORY_KEYWORDS.put("Education", List.of(
                "course", "tuition", "school", "college", "udemy", "coursera", "education"));
        CATEGORY_KEYWORDS.put("Finance", List.of(
                "investment", "loan", "insurance", "mutual fund", "zerodha", "groww", "emi", "sip"));
        CATEGORY_KEYWORDS.put("People", List.of(
                "sent to", "received from", "upi transfer", "upi received", "transfer to", "friend", "family"));
    }

    private static final Map<String, Pattern> WORD_PATTERNS = new LinkedHashMap<>();

    static {
        CATEGORY_KEYWORDS.values().stream()
                .flatMap(List::stream)
                .filter(kw -> kw.length() <= 4)
                .forEach(kw -> WORD_PATTERNS.put(kw, Pattern.compile("\\b" + Pattern.quote(kw) + "\\b")));
    }

    @Override
    public Map<String, String> classify(List<ClassificationQuery> queries, String accessToken) {
        Map<String, String> result = new LinkedHashMap<>();
        for (ClassificationQuery q : queries) {
            String category = classifyOne(q.description(), q.merchant());
            if (!CanonicalTransaction.UNCATEGORIZED.equals(category)) {
                result.putIfAbsent(q.description(), category);
            }
        }
        return result;
    }

    public String classifyOne(String description, String merchant) {
        String text = ((description == null ? "" : description) + " " + (merchant == null ? "" : merchant))
                .toLowerCase(Locale.ROOT);

        for (Map.Entry<String, List<String>> e : CATEGORY_KEYWORDS.entrySet()) {
            for (String kw : e.getValue()) {
                boolean hit = kw.length() <= 4 ? WORD_PATTERNS.get(kw).matcher(text).find() : text.contains(kw);
                if (hit) return e.getKey();
            }
        }
        return CanonicalTransaction.UNCATEGORIZED;
    }
}
