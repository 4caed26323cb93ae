// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * Base class for exceptions thrown throughout this library.
 */
public class SoonException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    public SoonException() { super(); }
    public SoonException(String message) { super(message); }
    public SoonException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new exception with the given cause, copying the message
     * from the cause into this instance.
     * @param cause
     *     the root cause of the exception; must not be null.
     */
    public SoonException(Throwable cause) { super(cause.getMessage(), cause); }


    /**
     * Finds the first exception in the {@link #getCause()} chain that is
     * an instance of the given type.
     *
     * @return null if there's no cause of the given type.
     */
    @SuppressWarnings("unchecked")
    public <T extends Throwable> T causeOfType(Class<T> type)
    {
        Throwable cause = getCause();
        while (cause != null && ! type.isInstance(cause))
        {
            cause = cause.getCause();
        }
        return (T) cause;
    }
}
