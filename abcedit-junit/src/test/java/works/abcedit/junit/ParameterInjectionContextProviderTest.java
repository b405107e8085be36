package works.abcedit.junit;

import java.lang.reflect.Parameter;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.TestInstance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.TestInstance.Lifecycle.PER_CLASS;

@InjectFrom({
	ParameterInjectionContextProviderTest.StringInjector.class,
	ParameterInjectionContextProviderTest.IntInjector.class,
	ParameterInjectionContextProviderTest.BooleanInjector.class,
	ParameterInjectionContextProviderTest.OverridingIntInjector.class,
})
@TestInstance(PER_CLASS)
class ParameterInjectionContextProviderTest {
	final Map<String, Set<List<Object>>> actual = new HashMap<>();

	@AfterAll
	void checkAll() {
		assertEquals(Set.of(
			List.of("foo", 7, true),
			List.of("foo", 7, false),
			List.of("foo", 8, true),
			List.of("foo", 8, false),
			List.of("bar", 7, true),
			List.of("bar", 7, false),
			List.of("bar", 8, true),
			List.of("bar", 8, false)
		), actual.get("everything"));
		assertEquals(Set.of(List.of(true), List.of(false)), actual.get("booleanOnly"));
	}

	@InjectedTest
	void everything(String s, int n, boolean b, TestInfo info) {
		observe("everything", s, n, b);
		assertEquals("everything", info.getTestMethod().orElseThrow().getName());
	}

	@InjectedTest
	void booleanOnly(boolean b) {
		observe("booleanOnly", b);
	}

	@Test
	void cartesianProductOfNothingIsOneEmptyCombination() {
		assertEquals(List.of(List.of()), ParameterInjectionContextProvider.cartesianProduct(List.of()));
	}

	@Test
	void superclassInjectorsComeFirst() {
		assertEquals(
			List.of(StringInjector.class, IntInjector.class, BooleanInjector.class, OverridingIntInjector.class),
			ParameterInjectionContextProvider.injectorClasses(ParameterInjectionContextProviderTest.class));
	}

	private void observe(String testName, Object... args) {
		actual.computeIfAbsent(testName, k -> new LinkedHashSet<>()).add(List.of(args));
	}

	record StringInjector() implements ParameterInjector {
		@Override
		public boolean supportsParameter(Parameter parameter) {
			return parameter.getType() == String.class;
		}

		@Override
		public List<String> values() {
			return List.of("foo", "bar");
		}
	}

	record IntInjector() implements ParameterInjector {
		@Override
		public boolean supportsParameter(Parameter parameter) {
			return parameter.getType() == int.class;
		}

		@Override
		public List<Integer> values() {
			return List.of(1, 2, 3);
		}
	}

	record OverridingIntInjector() implements ParameterInjector {
		@Override
		public boolean supportsParameter(Parameter parameter) {
			return parameter.getType() == int.class;
		}

		@Override
		public List<Integer> values() {
			return List.of(7, 8);
		}
	}

	static final class BooleanInjector implements ParameterInjector {
		private final ParameterInjector delegate = ParameterInjector.ofType(boolean.class, List.of(true, false));

		@Override
		public boolean supportsParameter(Parameter parameter) {
			return delegate.supportsParameter(parameter);
		}

		@Override
		public List<?> values() {
			return delegate.values();
		}
	}
}
