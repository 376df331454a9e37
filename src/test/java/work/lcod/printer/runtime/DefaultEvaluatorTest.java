package work.lcod.printer.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import work.lcod.printer.support.PrinterTestSupport;
import work.lcod.printer.value.IntValue;
import work.lcod.printer.value.PathValue;
import work.lcod.printer.value.SourcePosition;
import work.lcod.printer.value.StorePath;
import work.lcod.printer.value.StringValue;
import work.lcod.printer.value.Thunk;
import work.lcod.printer.value.Value;

class DefaultEvaluatorTest {
    private final PrinterTestSupport support = new PrinterTestSupport();
    private final DefaultEvaluator evaluator = support.evaluator;

    @Test
    void forcesThunkOnceAndMemoizes() {
        var runs = new AtomicInteger();
        var thunk = Thunk.of(() -> IntValue.of(runs.incrementAndGet()));

        assertEquals(IntValue.of(1), evaluator.force(thunk).value());
        assertEquals(IntValue.of(1), evaluator.force(thunk).value());
        assertEquals(1, runs.get());
        assertEquals(Thunk.State.RESOLVED, thunk.state());
    }

    @Test
    void followsChainsOfThunks() {
        var inner = Thunk.of(() -> StringValue.of("deep"));
        var outer = Thunk.of(() -> inner);

        assertEquals(StringValue.of("deep"), evaluator.forceValue(outer));
        assertEquals(Thunk.State.RESOLVED, inner.state());
    }

    @Test
    void failedComputationIsReportedAndCanBeRetried() {
        var runs = new AtomicInteger();
        var thunk = Thunk.of(() -> {
            runs.incrementAndGet();
            throw new EvaluationException("boom");
        });

        var first = evaluator.force(thunk);
        assertTrue(first.isFailure());
        assertEquals("boom", first.error().getMessage());
        assertEquals(Thunk.State.PENDING, thunk.state());

        evaluator.force(thunk);
        assertEquals(2, runs.get());
    }

    @Test
    void selfDependentThunkFailsWithInfiniteRecursion() {
        var ref = new AtomicReference<Thunk>();
        var thunk = Thunk.of(() -> evaluator.forceValue(ref.get()));
        ref.set(thunk);

        var forced = evaluator.force(thunk);
        assertTrue(forced.isFailure());
        assertEquals("infinite recursion encountered", forced.error().getMessage());
        assertEquals(Thunk.State.PENDING, thunk.state());
    }

    @Test
    void concreteValuesPassThrough() {
        Value value = IntValue.of(7);
        assertSame(value, evaluator.force(value).value());
    }

    @Test
    void programmingErrorsPropagate() {
        var thunk = Thunk.of(() -> {
            throw new IllegalStateException("bug");
        });
        assertThrows(IllegalStateException.class, () -> evaluator.force(thunk));
        assertEquals(Thunk.State.PENDING, thunk.state());
    }

    @Test
    void coercesStoreStringsAndPaths() {
        assertEquals(
            new StorePath("abc-hello.drv"),
            evaluator.coerceToStorePath(StringValue.of("/nix/store/abc-hello.drv"))
        );
        assertEquals(
            new StorePath("abc-hello"),
            evaluator.coerceToStorePath(Thunk.of(() -> PathValue.of("/nix/store/abc-hello/bin/hello")))
        );
        assertEquals("/nix/store/abc-hello", evaluator.storePathDisplay(new StorePath("abc-hello")));
    }

    @Test
    void rejectsValuesOutsideTheStore() {
        var notInStore = assertThrows(
            EvaluationException.class,
            () -> evaluator.coerceToStorePath(StringValue.of("/tmp/hello"))
        );
        assertEquals("path '/tmp/hello' is not in the store", notInStore.getMessage());

        var wrongType = assertThrows(
            EvaluationException.class,
            () -> evaluator.coerceToStorePath(IntValue.of(1))
        );
        assertEquals("cannot coerce an integer to a store path", wrongType.getMessage());
    }

    @Test
    void rejectsStorePathsWithoutABaseName() {
        var emptyName = assertThrows(
            EvaluationException.class,
            () -> evaluator.coerceToStorePath(StringValue.of("/nix/store//x"))
        );
        assertEquals("path '/nix/store//x' is not a valid store path", emptyName.getMessage());

        assertThrows(EvaluationException.class, () -> evaluator.coerceToStorePath(StringValue.of("/nix/store/ ")));
    }

    @Test
    void honoursCustomStoreDirectory() {
        var custom = new DefaultEvaluator(support.symbols, "/gnu/store/", null);
        assertEquals(new StorePath("x-y"), custom.coerceToStorePath(StringValue.of("/gnu/store/x-y")));
        assertEquals("/gnu/store/x-y", custom.storePathDisplay(new StorePath("x-y")));
    }

    @Test
    void recognisesDerivationsByType() {
        assertTrue(evaluator.isDerivation(support.attrs("type", StringValue.of("derivation"))));
        assertTrue(evaluator.isDerivation(support.attrs("type", Thunk.of(() -> StringValue.of("derivation")))));
        assertFalse(evaluator.isDerivation(support.attrs("type", StringValue.of("package"))));
        assertFalse(evaluator.isDerivation(support.attrs(Map.of("name", StringValue.of("x")))));
        assertFalse(evaluator.isDerivation(support.attrs("type", PrinterTestSupport.failing("nope"))));
    }

    @Test
    void formatsPositionsAndSymbols() {
        assertEquals("/src/a.lc:3:5", evaluator.formatPosition(new SourcePosition("/src/a.lc", 3, 5)));
        assertEquals("drvPath", evaluator.resolveSymbol(evaluator.drvPathSymbol()));
    }

    @Test
    void pollThrowsOnceCancelled() {
        evaluator.pollCancellation();
        evaluator.cancellationToken().cancel();
        assertThrows(PrintCancelledException.class, evaluator::pollCancellation);
    }
}
