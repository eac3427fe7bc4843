package io.entityjdbc.intercept;

import java.sql.Statement;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

@Tag("unit-test")
public class CancelableCommandDispatcherTest {
    private final DbCommand command = new DbCommand(Mockito.mock(Statement.class), "DELETE FROM account");

    @Test
    public void whenNoInterceptors_expectProceed() {
        CancelableCommandDispatcher dispatcher = new CancelableCommandDispatcher();

        Assertions.assertTrue(dispatcher.executing(command, InterceptionContext.EMPTY));
    }

    @Test
    public void whenOneInterceptorVetoes_expectCancelAndAllInterceptorsAsked() {
        CancelableCommandDispatcher dispatcher = new CancelableCommandDispatcher();
        AtomicInteger asked = new AtomicInteger();
        dispatcher.getInternalDispatcher().add((CancelableCommandInterceptor) (cmd, context) -> {
            asked.incrementAndGet();
            return !cmd.getCommandText().startsWith("DELETE");
        });
        dispatcher.getInternalDispatcher().add((CancelableCommandInterceptor) (cmd, context) -> {
            asked.incrementAndGet();
            return true;
        });

        Assertions.assertFalse(dispatcher.executing(command, InterceptionContext.EMPTY));
        Assertions.assertEquals(2, asked.get());

        Assertions.assertTrue(dispatcher.executing(
                new DbCommand(command.getStatement(), "SELECT 1"), InterceptionContext.EMPTY));
    }

    @Test
    public void whenSessionBound_expectInterceptorSeesContext() {
        CancelableCommandDispatcher dispatcher = new CancelableCommandDispatcher();
        TestSession readOnly = new TestSession("read-only");
        dispatcher.getInternalDispatcher().add((CancelableCommandInterceptor) (cmd, context) ->
                !context.hasSession(readOnly));

        Assertions.assertFalse(dispatcher.executing(command, InterceptionContext.EMPTY.withSession(readOnly)));
        Assertions.assertTrue(dispatcher.executing(command, InterceptionContext.EMPTY));
    }
}
