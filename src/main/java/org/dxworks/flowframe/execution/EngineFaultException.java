package org.dxworks.flowframe.execution;

/** The engine was asked to do something its graph or lifecycle does not allow. */
public class EngineFaultException extends IllegalStateException {

    public EngineFaultException(String message) {
        super(message);
    }
}
