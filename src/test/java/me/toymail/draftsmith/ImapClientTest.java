package me.toymail.draftsmith;

import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.search.SearchTerm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class ImapClientTest {

    private static final ImapClient.ImapConfig CFG =
            new ImapClient.ImapConfig("imap.example.com", 993, true, "me@example.com", "secret");

    private Store first;
    private Folder firstInbox;
    private Deque<Store> stores;
    private int opens;

    @BeforeEach
    void setUp() throws Exception {
        first = mock(Store.class);
        firstInbox = inbox();
        when(first.isConnected()).thenReturn(true);
        when(first.getFolder("INBOX")).thenReturn(firstInbox);
        stores = new ArrayDeque<>();
        stores.add(first);
    }

    private ImapClient connect() throws MessagingException {
        return ImapClient.connect(CFG, (session, cfg) -> {
            opens++;
            assertEquals(CFG, cfg);
            return stores.pop();
        });
    }

    private static Folder inbox() throws MessagingException {
        Folder folder = mock(Folder.class, withSettings().extraInterfaces(UIDFolder.class));
        when(folder.exists()).thenReturn(true);
        when(folder.getFullName()).thenReturn("INBOX");
        return folder;
    }

    @Test
    public void testReconnect_DroppedStoreIsReplacedAndInboxReopened() throws Exception {
        Store second = mock(Store.class);
        Folder secondInbox = inbox();
        when(second.isConnected()).thenReturn(true);
        when(second.getFolder("INBOX")).thenReturn(secondInbox);
        stores.add(second);
        ImapClient client = connect();

        when(first.isConnected()).thenReturn(false);
        when(firstInbox.isOpen()).thenReturn(false);
        assertThrows(MessagingException.class, () -> client.search(SearchCriteria.UNSEEN));

        client.reconnect();

        assertEquals(2, opens);
        verify(secondInbox).open(Folder.READ_WRITE);
        when(secondInbox.isOpen()).thenReturn(true);
        when(secondInbox.search(any(SearchTerm.class))).thenReturn(new Message[0]);
        assertEquals(List.of(), client.search(SearchCriteria.UNSEEN));
    }

    @Test
    public void testReconnect_ClosedFolderOnLiveStoreIsReopened() throws Exception {
        ImapClient client = connect();
        when(firstInbox.isOpen()).thenReturn(false);

        client.reconnect();

        assertEquals(1, opens);
        verify(first, times(2)).getFolder("INBOX");
        verify(firstInbox, times(2)).open(Folder.READ_WRITE);
    }

    @Test
    public void testReconnect_HealthySessionIsLeftAlone() throws Exception {
        ImapClient client = connect();
        when(firstInbox.isOpen()).thenReturn(true);

        client.reconnect();

        assertEquals(1, opens);
        verify(first, times(1)).getFolder("INBOX");
        verify(firstInbox, never()).close(anyBoolean());
    }

    @Test
    public void testReconnect_FailedReopenPropagates() throws Exception {
        ImapClient client = ImapClient.connect(CFG, (session, cfg) -> {
            if (opens++ > 0) {
                throw new MessagingException("connection refused");
            }
            return first;
        });
        when(first.isConnected()).thenReturn(false);

        MessagingException e = assertThrows(MessagingException.class, client::reconnect);

        assertEquals("connection refused", e.getMessage());
    }
}
