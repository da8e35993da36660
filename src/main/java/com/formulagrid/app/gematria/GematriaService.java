package com.formulagrid.app.gematria;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The cipher subsystem. Owns the calculators and answers "value of this text under
 * that cipher"; formulas reach it only through {@link GematriaOperationHandler}.
 */
@Service
public class GematriaService {

    // Upper-cased cipher name -> calculator, in registration order
    private final Map<String, GematriaCalculator> calculators = new LinkedHashMap<>();

    public GematriaService() {
        this(Arrays.asList(
                new TqGematriaCalculator(),
                new HebrewStandardCalculator(),
                new HebrewSofitCalculator(),
                new GreekIsopsephyCalculator()));
    }

    public GematriaService(List<GematriaCalculator> calculators) {
        for (GematriaCalculator calculator : calculators) {
            this.calculators.put(key(calculator.getName()), calculator);
        }
    }

    /**
     * @throws IllegalArgumentException if the cipher is unknown
     */
    public long calculate(String text, String cipher) {
        GematriaCalculator calculator = findCalculator(cipher);
        if (calculator == null) {
            throw new IllegalArgumentException("Unknown cipher: " + cipher);
        }
        return calculator.calculate(text);
    }

    public GematriaCalculator findCalculator(String cipher) {
        return cipher == null ? null : calculators.get(key(cipher));
    }

    public boolean hasCipher(String cipher) {
        return findCalculator(cipher) != null;
    }

    /** Display names of all ciphers. */
    public List<String> getCipherNames() {
        List<String> names = new ArrayList<>();
        for (GematriaCalculator calculator : calculators.values()) {
            names.add(calculator.getName());
        }
        return names;
    }

    private static String key(String cipher) {
        return cipher.trim().toUpperCase(Locale.ROOT);
    }
}
