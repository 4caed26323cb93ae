// Copyright The SOON Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package org.soon;

/**
 * The outcome of {@link SoonDecoder#validate(CharSequence)}.
 */
public final class ValidationResult
{
    private static final ValidationResult VALID = new ValidationResult(null);

    private final SoonDecodeException myError;

    private ValidationResult(SoonDecodeException error)
    {
        myError = error;
    }

    public static ValidationResult valid()
    {
        return VALID;
    }

    public static ValidationResult invalid(SoonDecodeException error)
    {
        if (error == null) throw new NullPointerException("error");
        return new ValidationResult(error);
    }

    public boolean isValid()
    {
        return myError == null;
    }

    /**
     * @return the error that made the text invalid, or null if it is valid.
     */
    public SoonDecodeException getError()
    {
        return myError;
    }

    @Override
    public String toString()
    {
        return (myError == null ? "valid" : "invalid: " + myError.getMessage());
    }
}
