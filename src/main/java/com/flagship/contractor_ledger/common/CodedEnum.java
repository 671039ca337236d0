package com.flagship.contractor_ledger.common;

import com.flagship.contractor_ledger.exception.ValidationException;

/**
 * Enum whose persisted and wire form is a lowercase code rather than the constant name.
 */
public interface CodedEnum {

    String code();

    /**
     * Resolves a code against the constants of an enum.
     *
     * @throws ValidationException if the code is null or unknown
     */
    static <E extends Enum<E> & CodedEnum> E fromCode(Class<E> type, String code) {
        if (code == null) {
            throw new ValidationException(type.getSimpleName() + " code is required");
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.code().equalsIgnoreCase(code.trim())) {
                return constant;
            }
        }
        throw new ValidationException(
            String.format("Unknown %s: %s", type.getSimpleName(), code));
    }
}
