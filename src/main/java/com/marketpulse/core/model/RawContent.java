package com.marketpulse.core.model;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a payload component as raw or bulk content.
 * <p>
 * Raw components are kept in checkpoints but never copied into a
 * {@link FinalReport}; the consolidator replaces them with derived
 * statistics (counts, lengths, source identifiers).
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD, ElementType.METHOD})
public @interface RawContent {
}
