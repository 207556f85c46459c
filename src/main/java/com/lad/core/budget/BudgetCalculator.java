package com.lad.core.budget;

import com.lad.core.config.LadProperties;
import com.lad.core.model.Budget;
import com.lad.core.model.ModelMetadata;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Converts a model's context window into an input-size budget.
 * <p>
 * {@code availableInputTokens = max(0, contextWindow - output - overhead)}, where
 * {@code output} is the fixed output reservation capped by the model's completion limit.
 * Characters are estimated at a fixed ratio per token and capped by an absolute ceiling
 * ({@code <= 0} meaning no ceiling). No I/O.
 */
@Component
public class BudgetCalculator {

    private final int charsPerToken;
    private final int absoluteMaxInputChars;

    @Autowired
    public BudgetCalculator(LadProperties properties) {
        this(properties.getBudget().getCharsPerToken(), properties.getBudget().getMaxInputChars());
    }

    public BudgetCalculator(int charsPerToken, int absoluteMaxInputChars) {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be > 0");
        }
        this.charsPerToken = charsPerToken;
        this.absoluteMaxInputChars = absoluteMaxInputChars;
    }

    public Budget compute(ModelMetadata metadata, int fixedOutputTokens, int overheadTokens) {
        int outputTokens = metadata.effectiveOutputTokens(fixedOutputTokens);
        long available = Math.max(0L, (long) metadata.contextWindowTokens() - outputTokens - overheadTokens);
        long chars = available * charsPerToken;
        if (absoluteMaxInputChars > 0) {
            chars = Math.min(chars, absoluteMaxInputChars);
        }
        return new Budget(
                (int) Math.min(available, Integer.MAX_VALUE),
                (int) Math.min(chars, Integer.MAX_VALUE),
                outputTokens,
                overheadTokens);
    }

    public int absoluteMaxInputChars() {
        return absoluteMaxInputChars;
    }
}
