package org.dxworks.flowframe.analyzer.recursion;

import org.dxworks.flowframe.model.recursion.ParameterTransformation;
import org.dxworks.flowframe.model.recursion.TransformationType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Describes how a recursive call changes each argument relative to the parameter it feeds. */
public final class TransformationClassifier {

    private static final Pattern ARITHMETIC = Pattern.compile("^([A-Za-z_]\\w*)([-+*/])(\\w+)$");
    private static final Pattern PROPERTY = Pattern.compile("^([A-Za-z_]\\w*)\\.(left|right|next|prev|parent|child)$",
            Pattern.CASE_INSENSITIVE);

    private TransformationClassifier() {
        // utility class
    }

    public static List<ParameterTransformation> classifyAll(List<String> arguments, List<String> parameters) {
        List<ParameterTransformation> result = new ArrayList<>();
        for (int i = 0; i < arguments.size(); i++) {
            String parameter = i < parameters.size() ? parameters.get(i) : null;
            result.add(classify(arguments.get(i), parameter));
        }
        return result;
    }

    public static ParameterTransformation classify(String argument, String parameter) {
        String compact = argument.replaceAll("\\s+", "");

        Matcher m = ARITHMETIC.matcher(compact);
        if (m.matches()) {
            TransformationType type;
            switch (m.group(2)) {
                case "-":
                    type = TransformationType.DECREMENT;
                    break;
                case "+":
                    type = TransformationType.INCREMENT;
                    break;
                case "/":
                    type = TransformationType.DIVIDE;
                    break;
                default:
                    type = TransformationType.MULTIPLY;
            }
            return new ParameterTransformation(m.group(1), m.group(1), compact, type, compact);
        }

        m = PROPERTY.matcher(compact);
        if (m.matches()) {
            return new ParameterTransformation(m.group(1), m.group(1), compact,
                    TransformationType.PROPERTY_ACCESS, compact);
        }

        String name = parameter != null ? parameter : compact;
        return new ParameterTransformation(name, name, compact, TransformationType.OTHER, compact);
    }

    /** Kinds that move an argument toward a base case. */
    public static boolean converges(TransformationType type) {
        return type == TransformationType.DECREMENT
                || type == TransformationType.INCREMENT
                || type == TransformationType.DIVIDE
                || type == TransformationType.PROPERTY_ACCESS;
    }
}
