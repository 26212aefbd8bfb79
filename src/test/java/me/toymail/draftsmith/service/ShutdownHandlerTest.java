package me.toymail.draftsmith.service;

import jakarta.mail.MessagingException;
import me.toymail.draftsmith.MailStore;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class ShutdownHandlerTest {

    @Test
    public void testRun_StopsLoopAndLogsOutOnce() throws Exception {
        ProcessingLoop loop = mock(ProcessingLoop.class);
        MailStore mailStore = mock(MailStore.class);
        ShutdownHandler handler = new ShutdownHandler(loop, mailStore);

        handler.run();
        handler.run();
        handler.run();

        assertTrue(handler.hasRun());
        verify(loop, times(1)).stop();
        verify(mailStore, times(1)).logout();
    }

    @Test
    public void testShutdown_ReportsWhetherThisCallDidTheWork() {
        ShutdownHandler handler = new ShutdownHandler(mock(ProcessingLoop.class), mock(MailStore.class));

        assertTrue(handler.shutdown());
        assertFalse(handler.shutdown());
    }

    @Test
    public void testRun_LogoutFailureDoesNotPropagate() throws Exception {
        ProcessingLoop loop = mock(ProcessingLoop.class);
        MailStore mailStore = mock(MailStore.class);
        doThrow(new MessagingException("already closed")).when(mailStore).logout();
        ShutdownHandler handler = new ShutdownHandler(loop, mailStore);

        assertDoesNotThrow(handler::run);
        verify(loop).stop();
    }

    @Test
    public void testRun_ConcurrentCallersLogOutOnce() throws Exception {
        MailStore mailStore = mock(MailStore.class);
        ShutdownHandler handler = new ShutdownHandler(null, mailStore);

        Thread a = new Thread(handler);
        Thread b = new Thread(handler);
        a.start();
        b.start();
        a.join();
        b.join();

        verify(mailStore, times(1)).logout();
    }
}
