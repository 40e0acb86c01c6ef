package org.carball.sqladvisor.rules;

import lombok.Value;
import org.carball.sqladvisor.error.RuleDataException;
import org.carball.sqladvisor.model.fact.AdvisoryFact;
import org.carball.sqladvisor.model.fact.AttributeKind;
import org.carball.sqladvisor.model.fact.AttributeSpec;
import org.carball.sqladvisor.model.fact.FactType;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single {@code attribute op value} test, e.g. {@code reuseCount >= 2}.
 */
@Value
public class Condition {

    private static final Pattern EXPRESSION =
            Pattern.compile("^\\s*([A-Za-z][A-Za-z0-9]*)\\s*(==|!=|>=|<=|>|<)\\s*(\\S+)\\s*$");

    String attribute;
    Operator operator;
    AttributeKind kind;
    Object expected;

    public static Condition parse(String expression, FactType factType) {
        if (expression == null) {
            throw new RuleDataException("Empty condition");
        }
        Matcher matcher = EXPRESSION.matcher(expression);
        if (!matcher.matches()) {
            throw new RuleDataException("Malformed condition: '" + expression + "'");
        }

        String attribute = matcher.group(1);
        Operator operator = Operator.fromSymbol(matcher.group(2))
                .orElseThrow(() -> new RuleDataException("Unknown operator in '" + expression + "'"));
        String literal = matcher.group(3);

        AttributeSpec spec = factType.attribute(attribute)
                .orElseThrow(() -> new RuleDataException(
                        String.format("Unknown attribute '%s' for %s facts", attribute, factType)));

        if (operator.isOrdering() && spec.getKind() != AttributeKind.NUMBER) {
            throw new RuleDataException(String.format(
                    "Operator %s is not defined for %s attribute '%s'", operator.getSymbol(), spec.getKind(), attribute));
        }

        return new Condition(attribute, operator, spec.getKind(), parseLiteral(spec, literal, expression));
    }

    private static Object parseLiteral(AttributeSpec spec, String literal, String expression) {
        switch (spec.getKind()) {
            case BOOLEAN:
                if ("true".equalsIgnoreCase(literal) || "false".equalsIgnoreCase(literal)) {
                    return Boolean.valueOf(literal.toLowerCase(Locale.ROOT));
                }
                throw new RuleDataException("Expected true or false in '" + expression + "'");
            case NUMBER:
                double number;
                try {
                    number = Double.parseDouble(literal);
                } catch (NumberFormatException e) {
                    throw new RuleDataException("Expected a number in '" + expression + "'", e);
                }
                if (!Double.isFinite(number)) {
                    throw new RuleDataException("Expected a finite number in '" + expression + "'");
                }
                return number;
            case ENUM:
                if (!spec.getAllowedValues().contains(literal)) {
                    throw new RuleDataException(String.format("'%s' is not one of %s in '%s'",
                            literal, spec.getAllowedValues(), expression));
                }
                return literal;
            default:
                throw new IllegalStateException("Unhandled attribute kind " + spec.getKind());
        }
    }

    public boolean test(AdvisoryFact fact) {
        Object actual = fact.attribute(attribute);
        if (actual == null) {
            return false;
        }
        if (kind == AttributeKind.NUMBER) {
            return operator.compare(((Number) actual).doubleValue(), (Double) expected);
        }
        boolean equal = expected.equals(actual);
        return operator == Operator.EQ ? equal : !equal;
    }

    @Override
    public String toString() {
        return attribute + " " + operator.getSymbol() + " " + expected;
    }
}
