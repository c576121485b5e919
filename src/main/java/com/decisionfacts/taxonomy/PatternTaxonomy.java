package com.decisionfacts.taxonomy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable, versioned set of categorized patterns that drives every extractor.
 *
 * A taxonomy is assembled once through {@link #builder(String)}; the builder
 * validates every entry and throws {@link TaxonomyException} on the first defect,
 * so a malformed taxonomy can never reach per-document processing.
 */
public final class PatternTaxonomy {

    /** Flags applied to every taxonomy pattern. Input text is matched lower-cased. */
    public static final int PATTERN_FLAGS =
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private final String version;
    private final double hitNormalizer;
    private final double preDispositiveDiscount;
    private final Map<MethodId, MethodProfile> profiles;
    private final Map<PatternCategory, List<PatternRule>> rulesByCategory;
    private final int patternCount;
    private final String fingerprint;

    private PatternTaxonomy(Builder builder) {
        this.version = builder.version;
        this.hitNormalizer = builder.hitNormalizer;
        this.preDispositiveDiscount = builder.preDispositiveDiscount;
        this.profiles = Collections.unmodifiableMap(new EnumMap<>(builder.profiles));

        Map<PatternCategory, List<PatternRule>> grouped = new EnumMap<>(PatternCategory.class);
        for (PatternCategory category : PatternCategory.values()) {
            grouped.put(category, new ArrayList<>());
        }
        for (PatternRule rule : builder.rules) {
            grouped.get(rule.category()).add(rule);
        }
        grouped.replaceAll((category, rules) -> List.copyOf(rules));
        this.rulesByCategory = Collections.unmodifiableMap(grouped);
        this.patternCount = builder.rules.size();
        this.fingerprint = computeFingerprint(builder);
    }

    public static Builder builder(String version) {
        return new Builder(version);
    }

    public String version() {
        return version;
    }

    /** Divisor turning a sum of pattern weights into a method's raw local confidence. */
    public double hitNormalizer() {
        return hitNormalizer;
    }

    /** Factor applied to structural hits found before the dispositive section. */
    public double preDispositiveDiscount() {
        return preDispositiveDiscount;
    }

    public MethodProfile profile(MethodId method) {
        return profiles.get(method);
    }

    public List<PatternRule> rules(PatternCategory category) {
        return rulesByCategory.get(category);
    }

    public int patternCount() {
        return patternCount;
    }

    /** SHA-256 over every rule and setting; differs whenever any pattern or weight differs. */
    public String fingerprint() {
        return fingerprint;
    }

    private static String computeFingerprint(Builder builder) {
        StringBuilder content = new StringBuilder(builder.version).append('\n')
            .append(builder.hitNormalizer).append('|').append(builder.preDispositiveDiscount).append('\n');
        for (MethodProfile profile : new EnumMap<>(builder.profiles).values()) {
            content.append(profile.method()).append('|').append(profile.weight())
                .append('|').append(profile.ceiling()).append('\n');
        }
        for (PatternRule rule : builder.rules) {
            content.append(rule.fingerprintLine()).append('\n');
        }
        return sha256Hex(content.toString());
    }

    public static String sha256Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

    public static final class Builder {

        private final String version;
        private double hitNormalizer = 2.0;
        private double preDispositiveDiscount = 0.5;
        private final Map<MethodId, MethodProfile> profiles = new EnumMap<>(MethodId.class);
        private final List<PatternRule> rules = new ArrayList<>();
        private final Set<String> ruleIds = new HashSet<>();

        private Builder(String version) {
            if (version == null || version.isBlank()) {
                throw new TaxonomyException("taxonomy version is required");
            }
            this.version = version;
        }

        public Builder hitNormalizer(double value) {
            if (!(value > 0)) {
                throw new TaxonomyException("hit normalizer must be > 0, got " + value);
            }
            this.hitNormalizer = value;
            return this;
        }

        public Builder preDispositiveDiscount(double value) {
            requireUnitInterval(value, "pre-dispositive discount");
            this.preDispositiveDiscount = value;
            return this;
        }

        public Builder method(MethodId method, double weight, double ceiling) {
            if (method == null) {
                throw new TaxonomyException("method id is required");
            }
            requireUnitInterval(weight, "weight of method " + method);
            requireUnitInterval(ceiling, "ceiling of method " + method);
            if (profiles.putIfAbsent(method, new MethodProfile(method, weight, ceiling)) != null) {
                throw new TaxonomyException("method profile declared twice: " + method);
            }
            return this;
        }

        public Builder rule(String id, PatternCategory category, Polarity polarity, double weight, String regex) {
            if (id == null || id.isBlank()) {
                throw new TaxonomyException("pattern id is required");
            }
            if (!ruleIds.add(id)) {
                throw new TaxonomyException("duplicate pattern id: " + id);
            }
            if (category == null || polarity == null) {
                throw new TaxonomyException("pattern " + id + " needs a category and a polarity");
            }
            if (category.isLocator() != (polarity == Polarity.CONTEXT)) {
                throw new TaxonomyException("pattern " + id + ": polarity " + polarity
                    + " is not allowed in category " + category);
            }
            requireUnitInterval(weight, "weight of pattern " + id);
            if (regex == null || regex.isBlank()) {
                throw new TaxonomyException("pattern " + id + " has an empty expression");
            }
            Pattern compiled;
            try {
                compiled = Pattern.compile(regex, PATTERN_FLAGS);
            } catch (PatternSyntaxException ex) {
                throw new TaxonomyException("pattern " + id + " is not a valid expression: " + ex.getDescription(), ex);
            }
            rules.add(new PatternRule(id, category, polarity, weight, compiled));
            return this;
        }

        public PatternTaxonomy build() {
            for (MethodId method : MethodId.values()) {
                if (!profiles.containsKey(method)) {
                    throw new TaxonomyException("missing profile for method " + method);
                }
            }
            return new PatternTaxonomy(this);
        }

        private static void requireUnitInterval(double value, String what) {
            if (!(value > 0 && value <= 1.0)) {
                throw new TaxonomyException(what + " must be in (0, 1], got " + value);
            }
        }
    }
}
