package fr.imt.shellbridge.shellbridge.business.service;

import fr.imt.shellbridge.shellbridge.business.model.ChannelOutput;
import fr.imt.shellbridge.shellbridge.business.model.CommandResult;
import fr.imt.shellbridge.shellbridge.business.model.QuotingMode;
import fr.imt.shellbridge.shellbridge.business.model.ShellSession;
import fr.imt.shellbridge.shellbridge.business.port.TransportSession;
import fr.imt.shellbridge.shellbridge.configuration.ShellbridgeProperties;
import fr.imt.shellbridge.shellbridge.exception.CommandTimeoutException;
import fr.imt.shellbridge.shellbridge.exception.SshConnectionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CommandExecutorTest {

    private static final String HOME = "/home/alice";

    private ShellbridgeProperties properties;
    private CommandExecutor executor;
    private ScriptedTransportSession transport;
    private ShellSession session;

    @BeforeEach
    void setUp() {
        properties = new ShellbridgeProperties();
        executor = new CommandExecutor(properties);
        transport = new ScriptedTransportSession(HOME, Set.of(HOME, "/tmp", "/var/log"));
        session = new ShellSession(transport);
        executor.probeWorkingDirectory(session);
    }

    @Test
    void probeWorkingDirectory_storesStrippedPwdWithoutPty() {
        assertEquals(HOME, session.getCurrentDirectory());
        assertEquals(List.of("pwd"), transport.commandLines());
        assertEquals(List.of(false), transport.ptyRequests());
    }

    @Test
    void successfulCd_movesDirectoryAndHidesPwdOutput() {
        CommandResult result = executor.execute(session, "cd /tmp");

        assertEquals("cd /tmp && pwd", transport.lastCommandLine());
        assertEquals("", result.stdout());
        assertEquals(0, result.exitStatus());
        assertTrue(result.success());
        assertEquals("/tmp", result.currentDirectory());
        assertEquals("/tmp", session.getCurrentDirectory());
    }

    @Test
    void commandAfterCd_runsInTrackedDirectory() {
        executor.execute(session, "cd /tmp");

        CommandResult result = executor.execute(session, "pwd");

        assertEquals("cd '/tmp' && pwd", transport.lastCommandLine());
        assertEquals("/tmp\n", result.stdout());
        assertEquals("/tmp", result.currentDirectory());
    }

    @Test
    void failedCd_keepsDirectoryAndReportsOutput() {
        String before = session.getCurrentDirectory();

        CommandResult result = executor.execute(session, "cd /nonexistent");

        assertEquals(1, result.exitStatus());
        assertFalse(result.success());
        assertTrue(result.stderr().contains("No such file or directory"));
        assertEquals(before, result.currentDirectory());
        assertEquals(before, session.getCurrentDirectory());
    }

    @Test
    void bareCd_goesHome() {
        executor.execute(session, "cd /var/log");

        CommandResult result = executor.execute(session, "cd");

        assertEquals("cd  && pwd", transport.lastCommandLine());
        assertEquals(HOME, result.currentDirectory());
    }

    @Test
    void nonZeroExit_isANormalResult() {
        CommandResult result = executor.execute(session, "false");

        assertEquals(1, result.exitStatus());
        assertFalse(result.success());
        assertEquals(HOME, result.currentDirectory());
    }

    @Test
    void commandsRunWithPty() {
        executor.execute(session, "ls");
        executor.execute(session, "cd /tmp");

        assertEquals(List.of(false, true, true), transport.ptyRequests());
    }

    @Test
    void sessionWithoutDirectory_neverSendsEmptyCdPrefix() {
        ScriptedTransportSession fresh = new ScriptedTransportSession(HOME, Set.of(HOME));
        ShellSession unprobed = new ShellSession(fresh);

        CommandResult result = executor.execute(unprobed, "ls -la");

        assertEquals("ls -la", fresh.lastCommandLine());
        assertEquals("", result.currentDirectory());
    }

    @Test
    void dispatchFailure_returnsMinusOneAndKeepsDirectory() {
        executor.execute(session, "cd /tmp");
        transport.failWith(new IOException("Channel is being closed"));

        CommandResult result = executor.execute(session, "ls");

        assertEquals(CommandResult.DISPATCH_FAILURE, result.exitStatus());
        assertFalse(result.success());
        assertEquals("", result.stdout());
        assertEquals("Command execution failed: Channel is being closed", result.stderr());
        assertEquals("/tmp", result.currentDirectory());
    }

    @Test
    void posixQuoting_escapesTrackedDirectory() throws Exception {
        properties.getCommand().setQuoting(QuotingMode.POSIX);
        TransportSession mocked = mock(TransportSession.class);
        when(mocked.exec(anyString(), anyBoolean(), any())).thenReturn(new ChannelOutput("", "", 0));
        ShellSession quoted = new ShellSession(mocked);
        quoted.setCurrentDirectory("/srv/bob's files");

        executor.execute(quoted, "ls");

        verify(mocked).exec(eq("cd '/srv/bob'\\''s files' && ls"), eq(true), any());
    }

    @Test
    void configuredTimeout_isPassedToTransport() throws Exception {
        properties.getCommand().setTimeout(Duration.ofSeconds(5));
        TransportSession mocked = mock(TransportSession.class);
        when(mocked.exec(anyString(), anyBoolean(), any())).thenReturn(new ChannelOutput("", "", 0));

        executor.execute(new ShellSession(mocked), "uptime");

        verify(mocked).exec("uptime", true, Duration.ofSeconds(5));
    }

    @Test
    void timeout_propagatesAndLeavesDirectoryAlone() throws Exception {
        TransportSession mocked = mock(TransportSession.class);
        when(mocked.exec(anyString(), anyBoolean(), any())).thenThrow(new CommandTimeoutException(Duration.ofSeconds(1)));
        ShellSession slow = new ShellSession(mocked);
        slow.setCurrentDirectory("/opt");

        assertThrows(CommandTimeoutException.class, () -> executor.execute(slow, "cd /tmp"));
        assertEquals("/opt", slow.getCurrentDirectory());
    }

    @Test
    void probeWorkingDirectory_failsOnNonZeroExit() throws Exception {
        TransportSession mocked = mock(TransportSession.class);
        when(mocked.exec("pwd", false, Duration.ZERO)).thenReturn(new ChannelOutput("", "denied", 126));

        ShellSession broken = new ShellSession(mocked);

        assertThrows(SshConnectionException.class, () -> executor.probeWorkingDirectory(broken));
        assertEquals("", broken.getCurrentDirectory());
    }

    @Test
    void probeWorkingDirectory_wrapsChannelFailure() throws Exception {
        TransportSession mocked = mock(TransportSession.class);
        when(mocked.exec(anyString(), anyBoolean(), any())).thenThrow(new IOException("open failed"));

        SshConnectionException error = assertThrows(SshConnectionException.class,
                () -> executor.probeWorkingDirectory(new ShellSession(mocked)));
        assertEquals("SSH_ERR", error.getErrorCode());
    }
}
