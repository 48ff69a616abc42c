package org.dxworks.flowframe.model.recursion;

public class ParameterTransformation {
    public String parameterName;
    public String originalValue;
    public String transformedValue;
    public TransformationType transformationType;
    public String description; // e.g. "n-1", "node.left"

    public ParameterTransformation(String parameterName, String originalValue, String transformedValue,
                                   TransformationType transformationType, String description) {
        this.parameterName = parameterName;
        this.originalValue = originalValue;
        this.transformedValue = transformedValue;
        this.transformationType = transformationType;
        this.description = description;
    }
}
