package works.abcedit.junit;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import org.junit.jupiter.api.TestTemplate;
import org.junit.jupiter.api.extension.ExtendWith;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a test method that runs once for every combination of
 * the values the class's {@link ParameterInjector}s provide for its parameters.
 * <p>
 * Unlike {@code @ParameterizedTest}, which zips argument lists together,
 * this computes the cartesian product, which is what property tests over
 * "every input, every option" want.
 *
 * @see InjectFrom
 */
@Retention(RUNTIME)
@Target(METHOD)
@TestTemplate
@ExtendWith(ParameterInjectionContextProvider.class)
public @interface InjectedTest {
}
