package dev.fumaz.locus.invoke;

import dev.fumaz.locus.annotation.Named;
import dev.fumaz.locus.bind.RegistrationOption;
import dev.fumaz.locus.container.Container;
import dev.fumaz.locus.container.Resolver;
import dev.fumaz.locus.exception.NameNotExistException;
import dev.fumaz.locus.exception.NotExistException;
import dev.fumaz.locus.exception.ProvisionException;
import dev.fumaz.locus.exception.ValidationException;
import dev.fumaz.locus.type.TypeKey;
import dev.fumaz.locus.type.TypeLiteral;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.lang.reflect.Method;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InvokerTest {

    interface Greeter {
        String name();
    }

    static class SimpleGreeter implements Greeter {
        private final String name;

        SimpleGreeter(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }
    }

    static class Receiver {
        private final String prefix;

        Receiver(String prefix) {
            this.prefix = prefix;
        }

        String describe(Greeter greeter) {
            return prefix + greeter.name();
        }
    }

    static final AtomicInteger CALLS = new AtomicInteger();

    static String greet(Greeter greeter, String greeting) {
        return greeting + " " + greeter.name();
    }

    static Greeter[] array(Greeter[] greeters) {
        return greeters;
    }

    static Greeter[] variadic(Greeter... greeters) {
        return greeters;
    }

    static String prefixedVariadic(String prefix, Greeter... greeters) {
        StringBuilder builder = new StringBuilder(prefix);
        for (Greeter greeter : greeters) {
            builder.append(' ').append(greeter.name());
        }
        return builder.toString();
    }

    static List<Greeter> list(List<Greeter> greeters) {
        return greeters;
    }

    static Collection<Greeter> collection(Collection<? extends Greeter> greeters) {
        return List.copyOf(greeters);
    }

    static Map<String, Greeter> map(Map<String, Greeter> greeters) {
        return greeters;
    }

    static String named(@Named("formal") Greeter greeter) {
        return greeter.name();
    }

    static int primitive(int value) {
        return value * 2;
    }

    static String generic(Supplier<String> supplier) {
        return supplier.get();
    }

    static List<String> strings(List<String> values) {
        return values;
    }

    static String counted(Greeter greeter) {
        CALLS.incrementAndGet();
        return greeter.name();
    }

    static void nothing(Greeter greeter) {
        CALLS.incrementAndGet();
    }

    static String failing() throws IOException {
        throw new IOException("boom");
    }

    static String nestedFailure(Resolver resolver) {
        return resolver.resolve(Integer.class).toString();
    }

    private Container container;

    @BeforeEach
    void setUp() {
        container = Container.create();
        CALLS.set(0);
    }

    private static Method method(String name, Class<?>... parameterTypes) throws NoSuchMethodException {
        return InvokerTest.class.getDeclaredMethod(name, parameterTypes);
    }

    @Test
    void invokesFunctionWithResolvedArguments() throws Exception {
        container.registerInstance(String.class, "hello");
        container.registerInstance(Greeter.class, new SimpleGreeter("test"), RegistrationOption.named("test"));

        Object result = Invoker.invoke(container, method("greet", Greeter.class, String.class));

        assertEquals("hello test", result);
    }

    @Test
    void invokesObjectWithSinglePublicMethod() {
        container.registerInstance(String.class, "hello");
        container.registerInstance(Greeter.class, new SimpleGreeter("test"));

        Object result = Invoker.invoke(container, new Object() {
            public String apply(Greeter greeter, String greeting) {
                return greeting + " " + greeter.name();
            }
        });

        assertEquals("hello test", result);
    }

    @Test
    void invokesInstanceMethodOnReceiver() throws Exception {
        container.registerInstance(Greeter.class, new SimpleGreeter("world"));

        Object result = Invoker.invoke(container, new Receiver("hello "),
                Receiver.class.getDeclaredMethod("describe", Greeter.class));

        assertEquals("hello world", result);
    }

    @Test
    void arrayParameterKeepsRegistrationOrder() throws Exception {
        Greeter first = new SimpleGreeter("one");
        Greeter second = new SimpleGreeter("two");
        container.registerInstance(Greeter.class, first);
        container.registerInstance(Greeter.class, second);

        Object result = Invoker.invoke(container, method("array", Greeter[].class));

        assertArrayEquals(new Greeter[]{first, second}, (Greeter[]) result);
    }

    @Test
    void variadicParameterReceivesEachRegistration() throws Exception {
        Greeter first = new SimpleGreeter("one");
        Greeter second = new SimpleGreeter("two");
        container.registerInstance(Greeter.class, first);
        container.registerInstance(Greeter.class, second);

        Object result = Invoker.invoke(container, method("variadic", Greeter[].class));

        assertArrayEquals(new Greeter[]{first, second}, (Greeter[]) result);
    }

    @Test
    void variadicTailFollowsScalarParameters() throws Exception {
        container.registerInstance(String.class, "greeters:");
        container.registerInstance(Greeter.class, new SimpleGreeter("a"));
        container.registerInstance(Greeter.class, new SimpleGreeter("b"));

        Object result = Invoker.invoke(container, method("prefixedVariadic", String.class, Greeter[].class));

        assertEquals("greeters: a b", result);
    }

    @Test
    void listParameterKeepsRegistrationOrder() throws Exception {
        Greeter first = new SimpleGreeter("one");
        Greeter second = new SimpleGreeter("two");
        container.registerInstance(Greeter.class, first);
        container.registerInstance(Greeter.class, second);

        assertEquals(List.of(first, second), Invoker.invoke(container, method("list", List.class)));
    }

    @Test
    void wildcardCollectionUsesUpperBound() throws Exception {
        Greeter greeter = new SimpleGreeter("one");
        container.registerInstance(Greeter.class, greeter);

        assertEquals(List.of(greeter), Invoker.invoke(container, method("collection", Collection.class)));
    }

    @Test
    void mapParameterHoldsOnlyNamedRegistrations() throws Exception {
        Greeter x = new SimpleGreeter("x");
        Greeter y = new SimpleGreeter("y");
        container.registerInstance(Greeter.class, x, RegistrationOption.named("x"));
        container.registerInstance(Greeter.class, y, RegistrationOption.named("y"));
        container.registerInstance(Greeter.class, new SimpleGreeter("anonymous"));

        @SuppressWarnings("unchecked")
        Map<String, Greeter> result = (Map<String, Greeter>) Invoker.invoke(container, method("map", Map.class));

        assertEquals(Map.of("x", x, "y", y), result);
    }

    @Test
    void namedParameterResolvesByName() throws Exception {
        container.registerInstance(Greeter.class, new SimpleGreeter("casual"));
        container.registerInstance(Greeter.class, new SimpleGreeter("Good evening"), RegistrationOption.named("formal"));

        assertEquals("Good evening", Invoker.invoke(container, method("named", Greeter.class)));
    }

    @Test
    void namedParameterWithUnknownNameFails() throws Exception {
        container.registerInstance(Greeter.class, new SimpleGreeter("casual"));

        assertThrows(NameNotExistException.class, () -> Invoker.invoke(container, method("named", Greeter.class)));
    }

    @Test
    void primitiveParameterUsesWrapperRegistration() throws Exception {
        container.registerInstance(Integer.class, 21);

        assertEquals(42, Invoker.invoke(container, method("primitive", int.class)));
    }

    @Test
    void nullForPrimitiveParameterIsRejected() throws Exception {
        container.registerInstance(Integer.class, null);

        assertThrows(ValidationException.class, () -> Invoker.invoke(container, method("primitive", int.class)));
    }

    @Test
    void genericParameterResolvesParameterizedKey() throws Exception {
        container.registerInstance(new TypeLiteral<Supplier<String>>() {}, () -> "supplied");
        container.registerInstance(new TypeLiteral<Supplier<Integer>>() {}, () -> 1);

        assertEquals("supplied", Invoker.invoke(container, method("generic", Supplier.class)));
    }

    @Test
    void listOfStringsCollectsStringRegistrations() throws Exception {
        container.registerInstance(String.class, "a");
        container.registerInstance(String.class, "b");

        assertEquals(List.of("a", "b"), Invoker.invoke(container, method("strings", List.class)));
    }

    @Test
    void resolutionFailureAbortsBeforeCalling() throws Exception {
        NotExistException exception = assertThrows(NotExistException.class,
                () -> Invoker.invoke(container, method("counted", Greeter.class)));

        assertEquals(TypeKey.of(Greeter.class), exception.getKey());
        assertEquals(0, CALLS.get());
    }

    @Test
    void emptySequenceTypeIsStillNotExist() throws Exception {
        assertThrows(NotExistException.class, () -> Invoker.invoke(container, method("variadic", Greeter[].class)));
    }

    @Test
    void voidCallableReturnsNull() throws Exception {
        container.registerInstance(Greeter.class, new SimpleGreeter("test"));

        assertNull(Invoker.invoke(container, method("nothing", Greeter.class)));
        assertEquals(1, CALLS.get());
    }

    @Test
    void thrownExceptionVoidsTheResult() throws Exception {
        ProvisionException exception = assertThrows(ProvisionException.class,
                () -> Invoker.invoke(container, method("failing")));

        assertInstanceOf(IOException.class, exception.getCause());
    }

    @Test
    void containerFailureInsideCallablePropagatesUnchanged() throws Exception {
        container.registerInstance(Resolver.class, container);

        assertThrows(NotExistException.class, () -> Invoker.invoke(container, method("nestedFailure", Resolver.class)));
    }

    @Test
    void worksWithAnyResolver() throws Exception {
        Greeter greeter = new SimpleGreeter("custom");
        Resolver resolver = new Resolver() {
            @Override
            public Object resolve(TypeKey key) {
                return key.equals(TypeKey.of(Greeter.class)) ? greeter : "hi";
            }

            @Override
            public List<Object> resolveAll(TypeKey key) {
                return List.of(resolve(key));
            }

            @Override
            public Object resolveByName(TypeKey key, String name) {
                return resolve(key);
            }

            @Override
            public Map<String, Object> resolveMap(TypeKey key) {
                return Map.of();
            }
        };

        assertEquals("hi custom", Invoker.invoke(resolver, method("greet", Greeter.class, String.class)));
    }

    @Test
    void wrongValueTypeIsRejected() throws Exception {
        Resolver lying = new Resolver() {
            @Override
            public Object resolve(TypeKey key) {
                return "not a greeter";
            }

            @Override
            public List<Object> resolveAll(TypeKey key) {
                return List.of();
            }

            @Override
            public Object resolveByName(TypeKey key, String name) {
                return null;
            }

            @Override
            public Map<String, Object> resolveMap(TypeKey key) {
                return Map.of();
            }
        };

        assertThrows(ValidationException.class, () -> Invoker.invoke(lying, method("counted", Greeter.class)));
        assertEquals(0, CALLS.get());
    }

    @Test
    void lambdasAreRejected() {
        Supplier<String> supplier = () -> "value";

        assertThrows(ValidationException.class, () -> Invoker.invoke(container, supplier));
    }

    @Test
    void objectWithoutSinglePublicMethodIsRejected() {
        assertThrows(ValidationException.class, () -> Invoker.invoke(container, new Object()));
        assertThrows(ValidationException.class, () -> Invoker.invoke(container, "two public methods and more"));
    }

    @Test
    void instanceMethodWithoutReceiverIsRejected() throws Exception {
        Method method = Receiver.class.getDeclaredMethod("describe", Greeter.class);

        assertThrows(ValidationException.class, () -> Invoker.invoke(container, method));
    }

    @Test
    void constructsClassesThroughTheirConstructor() {
        container.registerInstance(String.class, "constructed");

        SimpleGreeter greeter = Invoker.construct(container, SimpleGreeter.class);

        assertEquals("constructed", greeter.name());
    }

    @Test
    void invokesConstructor() throws Exception {
        container.registerInstance(String.class, "prefix ");
        container.registerInstance(Greeter.class, new SimpleGreeter("name"));

        Receiver receiver = Invoker.invoke(container, Receiver.class.getDeclaredConstructor(String.class));

        assertEquals("prefix name", receiver.describe(container.resolve(Greeter.class)));
        assertSame(Receiver.class, receiver.getClass());
    }
}
