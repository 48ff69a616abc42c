package org.dxworks.flowframe.execution;

public enum Decision {
    YES,
    NO
}
