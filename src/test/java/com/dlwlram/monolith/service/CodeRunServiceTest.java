package com.dlwlram.monolith.service;

import com.dlwlram.monolith.config.SandboxProperties;
import com.dlwlram.monolith.exception.ExecutionTimeoutException;
import com.dlwlram.monolith.exception.ProvisionException;
import com.dlwlram.monolith.exception.UnsupportedLanguageOperationException;
import com.dlwlram.monolith.language.SupportedLanguage;
import com.dlwlram.monolith.model.ExecutionResult;
import com.dlwlram.monolith.model.MemorySample;
import com.dlwlram.monolith.model.RunResponse;
import com.dlwlram.monolith.session.CodeSession;
import com.dlwlram.monolith.session.SandboxSessionFactory;
import com.dlwlram.monolith.timeout.TimeoutSupervisor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CodeRunServiceTest {

    private final CountDownLatch never = new CountDownLatch(1);

    private CodeRunService codeRunService;

    private SandboxSessionFactory sessionFactory;

    private CodeSession session;

    private TimeoutSupervisor timeoutSupervisor;

    @BeforeEach
    void setUp() {
        SandboxProperties properties = new SandboxProperties();
        properties.setSetupTimeout(1);
        properties.setRunTimeout(1);
        timeoutSupervisor = new TimeoutSupervisor(50);
        sessionFactory = mock(SandboxSessionFactory.class);
        session = mock(CodeSession.class);
        when(sessionFactory.openSession(SupportedLanguage.PYTHON, false)).thenReturn(session);

        codeRunService = new CodeRunService();
        ReflectionTestUtils.setField(codeRunService, "sandboxSessionFactory", sessionFactory);
        ReflectionTestUtils.setField(codeRunService, "timeoutSupervisor", timeoutSupervisor);
        ReflectionTestUtils.setField(codeRunService, "sandboxProperties", properties);
    }

    @AfterEach
    void tearDown() {
        never.countDown();
        timeoutSupervisor.shutdown();
    }

    @Test
    void successfulRunIsMappedToResponse() {
        ExecutionResult executionResult = new ExecutionResult();
        executionResult.setStdout("2\n");
        executionResult.setPeakMemoryKb(50);
        executionResult.setDurationMs(2.0);
        executionResult.setIntegralKbMs(110);
        executionResult.setMemorySeries(Arrays.asList(new MemorySample(0, 10), new MemorySample(2_000_000, 50)));
        when(session.run("print(1+1)", true)).thenReturn(executionResult);

        RunResponse response = codeRunService.execute("python", "print(1+1)", List.of("numpy"), true);

        assertThat(response.getError()).isNull();
        assertThat(response.getStdout()).isEqualTo("2\n");
        assertThat(response.getPeakMemoryKb()).isEqualTo(50L);
        assertThat(response.getIntegralKbMs()).isEqualTo(110L);
        assertThat(response.getMemorySeries()).hasSize(2);
        verify(session).setup(List.of("numpy"));
        verify(session).close();
    }

    @Test
    void setupIsSkippedWithoutLibraries() {
        when(session.run("print(1)", false)).thenReturn(new ExecutionResult());

        codeRunService.execute("python", "print(1)", null, false);

        verify(session, never()).setup(anyList());
        verify(session).close();
    }

    @Test
    void silentProgramStillHasOutput() {
        ExecutionResult executionResult = new ExecutionResult();
        executionResult.setExitCode(0L);
        when(session.run("pass", false)).thenReturn(executionResult);

        RunResponse response = codeRunService.execute("python", "pass", null, false);

        assertThat(response.getError()).isNull();
        assertThat(response.getStdout()).isEmpty();
        assertThat(response.getStderr()).isEmpty();
    }

    @Test
    void setupErrorEndsTheRequest() {
        when(session.setup(anyList())).thenThrow(new UnsupportedLanguageOperationException(SupportedLanguage.PYTHON, "not supported"));

        RunResponse response = codeRunService.execute("python", "print(1)", List.of("numpy"), false);

        assertThat(response.getError()).isEqualTo("not supported");
        verify(session, never()).run(anyString(), anyBoolean());
        verify(session).close();
    }

    @Test
    void runTimeoutIsReportedAsError() {
        when(session.run("while True: pass", false)).thenAnswer(invocation -> {
            never.await();
            return null;
        });

        RunResponse response = codeRunService.execute("python", "while True: pass", null, false);

        assertThat(response.getError()).contains("Timeout Reached");
        assertThat(response.getStdout()).isNull();
        verify(session).close();
    }

    @Test
    void openFailureIsReportedAsError() {
        when(sessionFactory.openSession(SupportedLanguage.PYTHON, false)).thenThrow(new ProvisionException("pull access denied"));

        RunResponse response = codeRunService.execute("python", "print(1)", null, false);

        assertThat(response.getError()).isEqualTo("pull access denied");
    }

    @Test
    void unknownLanguageIsReportedAsError() {
        RunResponse response = codeRunService.execute("cobol", "DISPLAY 'HI'", null, false);

        assertThat(response.getError()).contains("cobol");
        verify(sessionFactory, never()).openSession(SupportedLanguage.PYTHON, false);
    }

    @Test
    void timeoutErrorTypeIsKeptInMessage() {
        assertThat(new ExecutionTimeoutException("Code Execution", 60).getMessage())
                .isEqualTo("Code Execution Timeout Reached. (60 s)");
    }
}
