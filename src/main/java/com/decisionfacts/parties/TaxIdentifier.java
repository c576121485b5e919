package com.decisionfacts.parties;

import java.util.Optional;

/**
 * A Brazilian tax id in punctuated form: CPF {@code 000.000.000-00}
 * or CNPJ {@code 00.000.000/0000-00}.
 */
public record TaxIdentifier(Kind kind, String value) {

    public enum Kind {
        CPF,
        CNPJ
    }

    /** Build from any spelling of the digits; empty unless it has exactly 11 or 14 digits. */
    public static Optional<TaxIdentifier> fromDigits(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String d = raw.replaceAll("\\D", "");
        if (d.length() == 11) {
            return Optional.of(new TaxIdentifier(Kind.CPF,
                d.substring(0, 3) + "." + d.substring(3, 6) + "." + d.substring(6, 9) + "-" + d.substring(9)));
        }
        if (d.length() == 14) {
            return Optional.of(new TaxIdentifier(Kind.CNPJ,
                d.substring(0, 2) + "." + d.substring(2, 5) + "." + d.substring(5, 8) + "/" + d.substring(8, 12)
                    + "-" + d.substring(12)));
        }
        return Optional.empty();
    }
}
