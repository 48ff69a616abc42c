package org.dxworks.flowframe.model.recursion;

public class BaseCase {
    public String condition;
    public String returnValue;
    public ExitType exitType;
    public String comparisonOperator; // "==", "<=", ">=", "<", ">", "!=", "is", "is not"
    public String comparisonValue;
}
