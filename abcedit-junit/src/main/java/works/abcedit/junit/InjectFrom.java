package works.abcedit.junit;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Names the {@link ParameterInjector}s that supply parameters
 * to the {@link InjectedTest} methods of a test class.
 * <p>
 * When several injectors support the same parameter, the later one wins.
 * Annotations on superclasses count as earlier than those on subclasses,
 * so a subclass can override an injector its base class declares.
 * <p>
 * Each injector class needs a constructor taking no arguments.
 *
 * @see InjectedTest
 */
@Retention(RUNTIME)
@Target(TYPE)
public @interface InjectFrom {
	Class<? extends ParameterInjector>[] value();
}
