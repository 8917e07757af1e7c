package dev.vct.testunit.discovery;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a zero-argument method as a test case.
 *
 * <p>Static methods are invoked directly. Instance methods are invoked on a new instance
 * of the declaring class, created through its no-argument constructor, for every case.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface UnitCase {
	/**
	 * The case name; defaults to the method name.
	 */
	String value() default "";
}
