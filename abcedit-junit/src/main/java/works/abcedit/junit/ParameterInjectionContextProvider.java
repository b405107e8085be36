package works.abcedit.junit;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.extension.Extension;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.junit.jupiter.api.extension.TestTemplateInvocationContext;
import org.junit.jupiter.api.extension.TestTemplateInvocationContextProvider;

import static java.util.Arrays.asList;

/**
 * Implements the {@link InjectFrom} annotation.
 */
public class ParameterInjectionContextProvider implements TestTemplateInvocationContextProvider {

	@Override
	public boolean supportsTestTemplate(ExtensionContext context) {
		return context.getTestMethod().isPresent();
	}

	@Override
	public Stream<TestTemplateInvocationContext> provideTestTemplateInvocationContexts(ExtensionContext context) {
		List<Parameter> parameters = asList(context.getRequiredTestMethod().getParameters());
		List<ParameterInjector> injectors = instantiate(injectorClasses(context.getRequiredTestClass()));

		// Each parameter goes to the last injector that supports it
		var parametersByInjector = new LinkedHashMap<ParameterInjector, List<Parameter>>();
		for (Parameter p : parameters) {
			ParameterInjector chosen = null;
			for (ParameterInjector injector : injectors) {
				if (injector.supportsParameter(p)) {
					chosen = injector;
				}
			}
			if (chosen != null) {
				parametersByInjector.computeIfAbsent(chosen, k -> new ArrayList<>()).add(p);
			}
		}

		List<ParameterInjector> used = List.copyOf(parametersByInjector.keySet());
		List<List<?>> valueLists = used.stream().<List<?>>map(ParameterInjector::values).toList();
		String methodName = context.getRequiredTestMethod().getName();

		return cartesianProduct(valueLists).stream().map(combo -> {
			var bindings = new LinkedHashMap<Parameter, Object>();
			for (int i = 0; i < used.size(); i++) {
				for (Parameter p : parametersByInjector.get(used.get(i))) {
					bindings.put(p, combo.get(i));
				}
			}
			return invocation(methodName, combo, bindings);
		});
	}

	private static TestTemplateInvocationContext invocation(String methodName, List<Object> combo, Map<Parameter, Object> bindings) {
		return new TestTemplateInvocationContext() {
			@Override
			public String getDisplayName(int invocationIndex) {
				return methodName + "[" + invocationIndex + "] " + combo;
			}

			@Override
			public List<Extension> getAdditionalExtensions() {
				return List.of(new ParameterResolver() {
					@Override
					public boolean supportsParameter(ParameterContext pc, ExtensionContext ec) {
						return bindings.containsKey(pc.getParameter());
					}

					@Override
					public Object resolveParameter(ParameterContext pc, ExtensionContext ec) throws ParameterResolutionException {
						Parameter param = pc.getParameter();
						if (bindings.containsKey(param)) {
							return bindings.get(param);
						}
						throw new ParameterResolutionException("Parameter not bound: " + param);
					}
				});
			}
		};
	}

	/**
	 * @return the injector classes with superclass annotations first
	 */
	static List<Class<? extends ParameterInjector>> injectorClasses(Class<?> testClass) {
		List<Class<?>> bottomUp = new ArrayList<>();
		for (Class<?> c = testClass; c != null && c != Object.class; c = c.getSuperclass()) {
			bottomUp.add(c);
		}
		Collections.reverse(bottomUp);
		List<Class<? extends ParameterInjector>> result = new ArrayList<>();
		for (Class<?> c : bottomUp) {
			for (InjectFrom a : c.getAnnotationsByType(InjectFrom.class)) {
				result.addAll(asList(a.value()));
			}
		}
		return result;
	}

	private static List<ParameterInjector> instantiate(List<Class<? extends ParameterInjector>> classes) {
		List<ParameterInjector> result = new ArrayList<>();
		for (Class<? extends ParameterInjector> type : classes) {
			try {
				Constructor<? extends ParameterInjector> ctor = type.getDeclaredConstructor();
				ctor.setAccessible(true);
				result.add(ctor.newInstance());
			} catch (NoSuchMethodException e) {
				throw new ParameterResolutionException("Injector class needs a no-argument constructor: " + type, e);
			} catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
				throw new ParameterResolutionException("Error calling constructor on injector class " + type, e);
			}
		}
		return result;
	}

	static List<List<Object>> cartesianProduct(List<? extends List<?>> input) {
		List<List<Object>> result = List.of(List.of());
		for (List<?> list : input) {
			List<List<Object>> next = new ArrayList<>();
			for (List<Object> prefix : result) {
				for (Object v : list) {
					List<Object> combo = new ArrayList<>(prefix);
					combo.add(v);
					next.add(combo);
				}
			}
			result = next;
		}
		return result;
	}
}
