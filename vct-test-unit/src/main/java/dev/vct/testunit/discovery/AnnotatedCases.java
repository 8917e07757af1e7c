package dev.vct.testunit.discovery;

import dev.vct.testunit.CaseBody;
import dev.vct.testunit.CaseRegistry;
import dev.vct.testunit.TestCase;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Registers the {@link UnitCase} methods of a class.
 */
public final class AnnotatedCases {
	private AnnotatedCases() {}

	/**
	 * Registers every {@link UnitCase} method declared by {@code type}, ordered by case name.
	 *
	 * @return the registered cases
	 * @throws IllegalArgumentException if an annotated method takes parameters, or an instance
	 *                                  method's class has no no-argument constructor
	 */
	public static List<TestCase> register(CaseRegistry registry, Class<?> type) {
		String suiteName = suiteName(type);

		List<Method> methods = new ArrayList<>();
		for(var method : type.getDeclaredMethods()) {
			if(method.isAnnotationPresent(UnitCase.class)) {
				methods.add(method);
			}
		}
		methods.sort(Comparator.comparing(AnnotatedCases::caseName));

		// Validate every method before registering any of them.
		List<CaseBody> bodies = new ArrayList<>(methods.size());
		for(var method : methods) {
			bodies.add(bodyFor(type, method));
		}

		List<TestCase> registered = new ArrayList<>(methods.size());
		for(int i = 0; i < methods.size(); ++i) {
			registered.add(registry.register(suiteName, caseName(methods.get(i)), bodies.get(i)));
		}
		return registered;
	}

	static String suiteName(Class<?> type) {
		var suite = type.getAnnotation(UnitSuite.class);
		if(suite == null || suite.value().isBlank()) {
			return type.getSimpleName();
		}
		return suite.value();
	}

	static String caseName(Method method) {
		var name = method.getAnnotation(UnitCase.class).value();
		return name.isBlank() ? method.getName() : name;
	}

	private static CaseBody bodyFor(Class<?> type, Method method) {
		if(method.getParameterCount() != 0) {
			throw new IllegalArgumentException("Test case method must not take parameters: " + type.getName() + "." + method.getName());
		}

		method.setAccessible(true);

		if(Modifier.isStatic(method.getModifiers())) {
			return () -> invoke(method, null);
		}

		Constructor<?> constructor;
		try {
			constructor = type.getDeclaredConstructor();
		}
		catch(NoSuchMethodException e) {
			throw new IllegalArgumentException("Test case class must have a no-argument constructor: " + type.getName(), e);
		}
		constructor.setAccessible(true);

		return () -> invoke(method, newInstance(constructor));
	}

	private static Object newInstance(Constructor<?> constructor) throws Throwable {
		try {
			return constructor.newInstance();
		}
		catch(InvocationTargetException e) {
			throw e.getCause();
		}
	}

	private static void invoke(Method method, Object target) throws Throwable {
		try {
			method.invoke(target);
		}
		catch(InvocationTargetException e) {
			throw e.getCause();
		}
	}
}
