package de.bsommerfeld.dbqueue.core.value;

/**
 * Implemented by application types that know how to encode themselves for
 * binding. Instances can be passed directly as statement arguments.
 * Decoding goes through a {@link ValueConverter}, usually exposed as a
 * constant on the implementing type.
 */
@FunctionalInterface
public interface ValueConvertible {

    Value toValue();
}
