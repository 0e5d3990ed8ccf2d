package io.txretry.jdbc;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.txretry.jdbc.fault.DeadlockException;

@Tag("unit-test")
public class TransactionOptionsTest {
    private static final IsolationLevel SNAPSHOT = () -> "SNAPSHOT";

    @Test
    public void whenCreatingDefaults_expectSingleAttemptWithoutOverrides() {
        TransactionOptions options = TransactionOptions.create();

        Assertions.assertEquals(1, options.getAttempts());
        Assertions.assertTrue(options.getIsolationLevel().isEmpty());
        Assertions.assertFalse(options.hasRetryableExceptions());
        Assertions.assertTrue(options.getRetryableExceptionTypes().isEmpty());
    }

    @Test
    public void whenUsingDefaultConstant_expectSameSettingsAsCreate() {
        TransactionOptions defaults = TransactionOptions.defaults();
        TransactionOptions created = TransactionOptions.create();

        Assertions.assertSame(TransactionOptions.DEFAULT, defaults);
        Assertions.assertEquals(created.getAttempts(), defaults.getAttempts());
        Assertions.assertEquals(created.getIsolationLevel(), defaults.getIsolationLevel());
        Assertions.assertEquals(created.hasRetryableExceptions(), defaults.hasRetryableExceptions());
        Assertions.assertEquals(created.shouldRetry(new ThirdPartyException()),
                defaults.shouldRetry(new ThirdPartyException()));
    }

    @Test
    public void whenCreatingWithAttemptsAndIsolationLevel_expectValuesRetained() {
        TransactionOptions options = TransactionOptions.create(3, SNAPSHOT);

        Assertions.assertEquals(3, options.getAttempts());
        Assertions.assertSame(SNAPSHOT, options.getIsolationLevel().orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 5, 100, Integer.MAX_VALUE})
    public void whenAttemptsAtLeastOne_expectRoundTrip(int attempts) {
        Assertions.assertEquals(attempts, TransactionOptions.create(attempts).getAttempts());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, -5, Integer.MIN_VALUE})
    public void whenAttemptsBelowOne_expectConfigurationError(int attempts) {
        InvalidConfigurationException ex = Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.create(attempts));
        Assertions.assertTrue(ex.getMessage().contains("attempts must be at least 1, got " + attempts),
                ex.getMessage());
    }

    @Test
    public void whenAttemptsZero_expectMessageNamingValue() {
        InvalidConfigurationException ex = Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.create(0));
        Assertions.assertEquals("TransactionOptions: attempts must be at least 1, got 0.", ex.getMessage());
    }

    @Test
    public void whenConfigurationFails_expectIllegalArgumentException() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> TransactionOptions.create(0));
    }

    @Test
    public void whenCreatingWithTypeList_expectTypesRetained() {
        TransactionOptions options = TransactionOptions.create(1, null,
                List.of(ThirdPartyException.class, AnotherAppException.class));

        Assertions.assertTrue(options.hasRetryableExceptions());
        Assertions.assertEquals(List.of(ThirdPartyException.class, AnotherAppException.class),
                options.getRetryableExceptionTypes());
    }

    @Test
    public void whenCreatingWithPredicate_expectNoTypesListed() {
        TransactionOptions options = TransactionOptions.create(1, null,
                e -> e instanceof ThirdPartyException);

        Assertions.assertTrue(options.hasRetryableExceptions());
        Assertions.assertTrue(options.getRetryableExceptionTypes().isEmpty());
    }

    @Test
    public void whenCreatingWithNullTypeList_expectNoExtensionRule() {
        TransactionOptions options = TransactionOptions.create(2, null, (List<Class<?>>) null);

        Assertions.assertFalse(options.hasRetryableExceptions());
    }

    @Test
    public void whenTypeListIsEmpty_expectConfigurationError() {
        InvalidConfigurationException ex = Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.create(1, null, Collections.emptyList()));
        Assertions.assertTrue(ex.getMessage().contains("retryableExceptions must not be empty"), ex.getMessage());
    }

    @Test
    public void whenNoTypesGivenToBuilder_expectConfigurationError() {
        InvalidConfigurationException ex = Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.defaults().withRetryableExceptions(new Class<?>[0]));
        Assertions.assertTrue(ex.getMessage().contains("must not be empty"), ex.getMessage());
    }

    @Test
    public void whenTypeListContainsNull_expectConfigurationErrorWithIndex() {
        InvalidConfigurationException ex = Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.defaults()
                        .withRetryableExceptions(Arrays.asList(ThirdPartyException.class, null)));
        Assertions.assertTrue(ex.getMessage().contains("retryableExceptions[1] must be a class, got null"),
                ex.getMessage());
    }

    @Test
    public void whenTypeIsNotThrowable_expectConfigurationError() {
        InvalidConfigurationException ex = Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.defaults().withRetryableExceptions(String.class));
        Assertions.assertTrue(ex.getMessage().contains("retryableExceptions[0] \"java.lang.String\" must extend Throwable"),
                ex.getMessage());
    }

    @Test
    public void whenTypeIsInterface_expectConfigurationError() {
        InvalidConfigurationException ex = Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.defaults().withRetryableExceptions(Serializable.class));
        Assertions.assertTrue(ex.getMessage().contains("must extend Throwable"), ex.getMessage());
    }

    @Test
    public void whenSecondTypeIsInvalid_expectIndexOfSecondReported() {
        InvalidConfigurationException ex = Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.defaults().withRetryableExceptions(ThirdPartyException.class, Object.class));
        Assertions.assertTrue(ex.getMessage().contains("retryableExceptions[1]"), ex.getMessage());
    }

    @Test
    public void whenClassNameDoesNotExist_expectConfigurationError() {
        InvalidConfigurationException ex = Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.defaults().withRetryableExceptionNames("com.example.GhostException"));
        Assertions.assertTrue(ex.getMessage().contains("\"com.example.GhostException\" does not exist"),
                ex.getMessage());
        Assertions.assertInstanceOf(ClassNotFoundException.class, ex.getCause());
    }

    @Test
    public void whenClassNameIsBlank_expectConfigurationError() {
        InvalidConfigurationException ex = Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.defaults().withRetryableExceptionNames(" "));
        Assertions.assertTrue(ex.getMessage().contains("retryableExceptions[0] must be a class name"),
                ex.getMessage());
    }

    @Test
    public void whenClassNameIsNotThrowable_expectConfigurationError() {
        InvalidConfigurationException ex = Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.defaults().withRetryableExceptionNames("java.lang.StringBuilder"));
        Assertions.assertTrue(ex.getMessage().contains("\"java.lang.StringBuilder\" must extend Throwable"),
                ex.getMessage());
    }

    @Test
    public void whenFirstOfSeveralNamesInvalid_expectFirstIndexReported() {
        InvalidConfigurationException ex = Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.defaults().withRetryableExceptionNames(
                        "NonExistentClass", "java.lang.Object"));
        Assertions.assertTrue(ex.getMessage().contains("retryableExceptions[0]"), ex.getMessage());
    }

    @Test
    public void whenClassNamesResolve_expectTypesRetained() {
        TransactionOptions options = TransactionOptions.defaults()
                .withRetryableExceptionNames(ThirdPartyException.class.getName());

        Assertions.assertEquals(List.of(ThirdPartyException.class), options.getRetryableExceptionTypes());
        Assertions.assertTrue(options.shouldRetry(new ThirdPartyException()));
    }

    @Test
    public void whenPredicateIsNull_expectConfigurationError() {
        Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.defaults().withRetryableExceptions((Predicate<Throwable>) null));
    }

    @Test
    public void whenChangingAttempts_expectNewInstanceAndOriginalUntouched() {
        TransactionOptions original = TransactionOptions.create(1, SNAPSHOT, List.of(ThirdPartyException.class));
        TransactionOptions updated = original.withAttempts(5);

        Assertions.assertNotSame(original, updated);
        Assertions.assertEquals(1, original.getAttempts());
        Assertions.assertEquals(5, updated.getAttempts());
        Assertions.assertSame(SNAPSHOT, updated.getIsolationLevel().orElseThrow());
        Assertions.assertTrue(updated.shouldRetry(new ThirdPartyException()));
    }

    @Test
    public void whenChangingAttemptsBelowOne_expectConfigurationError() {
        InvalidConfigurationException ex = Assertions.assertThrows(InvalidConfigurationException.class,
                () -> TransactionOptions.defaults().withAttempts(0));
        Assertions.assertTrue(ex.getMessage().contains("at least 1"), ex.getMessage());
    }

    @Test
    public void whenChangingIsolationLevel_expectOtherFieldsPreserved() {
        TransactionOptions original = TransactionOptions.create(3, null, List.of(ThirdPartyException.class));
        TransactionOptions updated = original.withIsolationLevel(StandardIsolationLevel.SERIALIZABLE);

        Assertions.assertNotSame(original, updated);
        Assertions.assertTrue(original.getIsolationLevel().isEmpty());
        Assertions.assertEquals(StandardIsolationLevel.SERIALIZABLE, updated.getIsolationLevel().orElseThrow());
        Assertions.assertEquals(3, updated.getAttempts());
        Assertions.assertTrue(updated.shouldRetry(new ThirdPartyException()));
    }

    @Test
    public void whenChangingRetryableExceptions_expectOtherFieldsPreserved() {
        TransactionOptions original = TransactionOptions.create(5, SNAPSHOT);
        TransactionOptions updated = original.withRetryableExceptions(ThirdPartyException.class);

        Assertions.assertNotSame(original, updated);
        Assertions.assertFalse(original.hasRetryableExceptions());
        Assertions.assertFalse(original.shouldRetry(new ThirdPartyException()));
        Assertions.assertEquals(5, updated.getAttempts());
        Assertions.assertSame(SNAPSHOT, updated.getIsolationLevel().orElseThrow());
        Assertions.assertTrue(updated.shouldRetry(new ThirdPartyException()));
        Assertions.assertFalse(updated.shouldRetry(new AnotherAppException()));
    }

    @Test
    public void whenReplacingTypeListWithPredicate_expectTypesCleared() {
        TransactionOptions updated = TransactionOptions.defaults()
                .withRetryableExceptions(ThirdPartyException.class)
                .withRetryableExceptions(e -> e instanceof AnotherAppException);

        Assertions.assertTrue(updated.getRetryableExceptionTypes().isEmpty());
        Assertions.assertFalse(updated.shouldRetry(new ThirdPartyException()));
        Assertions.assertTrue(updated.shouldRetry(new AnotherAppException()));
    }

    @Test
    public void whenChangingRetryableExceptionsToInvalidType_expectValidationRerun() {
        TransactionOptions original = TransactionOptions.create(2);

        Assertions.assertThrows(InvalidConfigurationException.class,
                () -> original.withRetryableExceptions(Object.class));
    }

    @Test
    public void whenRemovingRetryableExceptions_expectRuleClearedAndFieldsPreserved() {
        TransactionOptions original = TransactionOptions.create(4, SNAPSHOT, List.of(ThirdPartyException.class));
        TransactionOptions updated = original.withoutRetryableExceptions();

        Assertions.assertNotSame(original, updated);
        Assertions.assertTrue(original.shouldRetry(new ThirdPartyException()));
        Assertions.assertFalse(updated.shouldRetry(new ThirdPartyException()));
        Assertions.assertFalse(updated.hasRetryableExceptions());
        Assertions.assertEquals(4, updated.getAttempts());
        Assertions.assertSame(SNAPSHOT, updated.getIsolationLevel().orElseThrow());
    }

    @Test
    public void whenRemovingRetryableExceptions_expectMarkerStillApplies() {
        TransactionOptions updated = TransactionOptions.defaults()
                .withRetryableExceptions(ThirdPartyException.class)
                .withoutRetryableExceptions();

        Assertions.assertTrue(updated.shouldRetry(new DeadlockException("deadlock")));
        Assertions.assertTrue(updated.shouldRetry(new OptimisticLockException()));
    }

    @Test
    public void whenRemovingAbsentRetryableExceptions_expectNoChangeInDecisions() {
        TransactionOptions updated = TransactionOptions.defaults().withoutRetryableExceptions();

        Assertions.assertFalse(updated.shouldRetry(new ThirdPartyException()));
    }

    @Test
    public void whenApplyingBuildersOnAllFields_expectOriginalUntouched() {
        TransactionOptions original = TransactionOptions.create();

        original.withAttempts(5);
        original.withIsolationLevel(SNAPSHOT);
        original.withRetryableExceptions(ThirdPartyException.class);

        Assertions.assertEquals(1, original.getAttempts());
        Assertions.assertTrue(original.getIsolationLevel().isEmpty());
        Assertions.assertFalse(original.shouldRetry(new ThirdPartyException()));
    }

    @Test
    public void whenChainingBuilders_expectDistinctInstances() {
        TransactionOptions a = TransactionOptions.defaults();
        TransactionOptions b = a.withAttempts(2);
        TransactionOptions c = b.withAttempts(3);

        Assertions.assertEquals(1, a.getAttempts());
        Assertions.assertEquals(2, b.getAttempts());
        Assertions.assertEquals(3, c.getAttempts());
        Assertions.assertNotSame(a, b);
        Assertions.assertNotSame(b, c);
    }

    @Test
    public void whenApplyingBuildersInDifferentOrder_expectSameState() {
        TransactionOptions first = TransactionOptions.defaults()
                .withAttempts(3)
                .withIsolationLevel(StandardIsolationLevel.REPEATABLE_READ)
                .withRetryableExceptions(ThirdPartyException.class);
        TransactionOptions second = TransactionOptions.defaults()
                .withRetryableExceptions(ThirdPartyException.class)
                .withIsolationLevel(StandardIsolationLevel.REPEATABLE_READ)
                .withAttempts(3);

        Assertions.assertEquals(first.getAttempts(), second.getAttempts());
        Assertions.assertEquals(first.getIsolationLevel(), second.getIsolationLevel());
        Assertions.assertEquals(first.getRetryableExceptionTypes(), second.getRetryableExceptionTypes());
        Assertions.assertEquals(first.toString(), second.toString());
    }

    @Test
    public void whenModifyingReturnedTypeList_expectUnsupported() {
        TransactionOptions options = TransactionOptions.defaults().withRetryableExceptions(ThirdPartyException.class);

        Assertions.assertThrows(UnsupportedOperationException.class,
                () -> options.getRetryableExceptionTypes().add(AnotherAppException.class));
    }
}
