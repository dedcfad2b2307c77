package com.plantmodel.flowsheet.expansion;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.plantmodel.flowsheet.exception.ConfigurationException;
import com.plantmodel.flowsheet.template.PlaceholderSubstitution;
import com.plantmodel.flowsheet.value.ParameterValue;

/**
 * Parses the closed condition grammar:
 * <pre>
 *   ${name|default}
 *   ${name|default} == literal
 *   name != literal
 * </pre>
 * Anything else is rejected.
 */
public class ConditionParser {

    private static final Pattern COMPARISON = Pattern.compile("(.+?)\\s*(==|!=)\\s*(.+)");
    private static final Pattern BARE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * @throws ConfigurationException for an unsupported shape
     */
    public Condition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Empty condition");
        }
        String text = expression.trim();

        Matcher placeholder = PlaceholderSubstitution.PLACEHOLDER.matcher(text);
        if (placeholder.matches()) {
            return new TruthyCondition(operand(placeholder));
        }

        Matcher comparison = COMPARISON.matcher(text);
        if (comparison.matches()) {
            String left = comparison.group(1).trim();
            String right = comparison.group(3).trim();
            if (right.contains("${") || right.contains("==") || right.contains("!=")) {
                throw unsupported(expression);
            }
            return new ComparisonCondition(leftOperand(left, expression),
                    "!=".equals(comparison.group(2)), ParameterValue.coerce(right));
        }
        throw unsupported(expression);
    }

    private static ParameterOperand leftOperand(String left, String expression) {
        Matcher placeholder = PlaceholderSubstitution.PLACEHOLDER.matcher(left);
        if (placeholder.matches()) {
            return operand(placeholder);
        }
        if (BARE_NAME.matcher(left).matches()) {
            return new ParameterOperand(left, null);
        }
        throw unsupported(expression);
    }

    private static ParameterOperand operand(Matcher placeholder) {
        return new ParameterOperand(placeholder.group(1).trim(), placeholder.group(2));
    }

    private static ConfigurationException unsupported(String expression) {
        return new ConfigurationException("Unsupported condition '" + expression
                + "'. Expected '${name|default}' or '<parameter> ==|!= <literal>'");
    }
}
