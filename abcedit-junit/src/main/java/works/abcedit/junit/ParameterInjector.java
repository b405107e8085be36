package works.abcedit.junit;

import java.lang.reflect.Parameter;
import java.util.List;

/**
 * Provides a series of possible values for the test parameters it supports.
 */
public interface ParameterInjector {
	/**
	 * Must give the same answer every time it's called with the same parameter.
	 */
	boolean supportsParameter(Parameter parameter);

	/**
	 * @return non-null, non-empty list of values
	 */
	List<?> values();

	static <T> ParameterInjector ofType(Class<T> type, List<? extends T> values) {
		return new ParameterInjector() {
			@Override
			public boolean supportsParameter(Parameter p) {
				return p.getType() == type;
			}

			@Override
			public List<? extends T> values() {
				return values;
			}
		};
	}
}
