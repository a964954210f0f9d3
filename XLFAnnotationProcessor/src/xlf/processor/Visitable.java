package xlf.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a syntax node class as a visitor target. The class must implement the generated {@code
 * Outer_Inner_Visitable} interface, which supplies {@code accept}.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface Visitable {}
