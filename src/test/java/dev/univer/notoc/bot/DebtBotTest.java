package dev.univer.notoc.bot;

import dev.univer.notoc.config.NotocProperties;
import dev.univer.notoc.model.Debtor;
import dev.univer.notoc.model.Tx;
import dev.univer.notoc.model.TxKind;
import dev.univer.notoc.model.User;
import dev.univer.notoc.service.DeadlineService;
import dev.univer.notoc.service.DebtorResolver;
import dev.univer.notoc.service.DebtorService;
import dev.univer.notoc.service.LedgerService;
import dev.univer.notoc.service.RecordService;
import dev.univer.notoc.service.RecordService.RecordCommand;
import dev.univer.notoc.service.RecordService.RecordOutcome;
import dev.univer.notoc.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DebtBotTest {

    private static final Long CHAT = 55L;
    private static final Long OWNER = 42L;

    @Mock private UserService userService;
    @Mock private DebtorResolver resolver;
    @Mock private DebtorService debtorService;
    @Mock private LedgerService ledgerService;
    @Mock private DeadlineService deadlineService;
    @Mock private RecordService recordService;
    @Mock private TelegramSender sender;

    private DebtBot bot;

    @BeforeEach
    void setUp() {
        bot = new DebtBot(userService, resolver, debtorService, ledgerService, deadlineService,
                          recordService, sender, new NotocProperties());
    }

    private static org.telegram.telegrambots.meta.api.objects.User account(Long id, String firstName) {
        org.telegram.telegrambots.meta.api.objects.User u = new org.telegram.telegrambots.meta.api.objects.User();
        u.setId(id);
        u.setFirstName(firstName);
        u.setIsBot(false);
        return u;
    }

    private static Message message(String text, org.telegram.telegrambots.meta.api.objects.User from) {
        Chat chat = new Chat();
        chat.setId(CHAT);
        chat.setType("private");
        Message m = new Message();
        m.setMessageId(10);
        m.setChat(chat);
        m.setFrom(from);
        m.setText(text);
        return m;
    }

    private static Update textUpdate(Message m) {
        Update u = new Update();
        u.setMessage(m);
        return u;
    }

    private static Update callback(String data) {
        CallbackQuery cq = new CallbackQuery();
        cq.setId("cb-1");
        cq.setFrom(account(OWNER, "Hoa"));
        cq.setMessage(message("Who did you mean?", account(1L, "bot")));
        cq.setData(data);
        Update u = new Update();
        u.setCallbackQuery(cq);
        return u;
    }

    private static RecordOutcome recorded(String name, String amount) {
        Debtor d = Debtor.builder().id(1L).name(name).build();
        Tx tx = Tx.builder().id(3L).debtor(d).amount(new BigDecimal(amount)).kind(TxKind.DEBT).build();
        return new RecordOutcome(d, tx, new BigDecimal(amount), List.of(), List.of());
    }

    @Test
    @DisplayName("Picking a candidate continues the pending record in the same chat session")
    void pickCandidate() throws Exception {
        when(recordService.continueWithDebtor(OWNER, "chat:55", 7L)).thenReturn(Optional.of(recorded("Tuan", "40")));

        bot.onUpdate(callback("debtor_7"));

        verify(sender).answer("cb-1");
        verify(sender).edit(eq(CHAT), eq(10), contains("Debt recorded for Tuan: 40"));
    }

    @Test
    @DisplayName("An expired choice is reported on the keyboard message")
    void expiredChoice() throws Exception {
        when(recordService.continueWithNewDebtor(OWNER, "chat:55")).thenReturn(Optional.empty());

        bot.onUpdate(callback("new_debtor"));

        verify(sender).edit(eq(CHAT), eq(10), contains("expired"));
    }

    @Test
    @DisplayName("Ordinary chat messages leave no trace")
    void ignoresChatter() {
        bot.onUpdate(textUpdate(message("see you tomorrow", account(OWNER, "Hoa"))));
        bot.onUpdate(textUpdate(message("/unknown stuff", account(OWNER, "Hoa"))));

        verifyNoInteractions(userService, recordService, ledgerService, sender);
    }

    @Test
    @DisplayName("Replying to someone with an amount records against their account")
    void replyRecordsForAccount() throws Exception {
        when(userService.getOrCreate(OWNER, "Hoa", null)).thenReturn(User.builder().id(1L).build());
        when(recordService.recordForAccount(any(RecordCommand.class), eq(77L))).thenReturn(recorded("Linh", "50000"));

        Message m = message("/add 50k coffee", account(OWNER, "Hoa"));
        m.setReplyToMessage(message("lunch?", account(77L, "Linh")));
        bot.onUpdate(textUpdate(m));

        ArgumentCaptor<RecordCommand> cmd = ArgumentCaptor.forClass(RecordCommand.class);
        verify(recordService).recordForAccount(cmd.capture(), eq(77L));
        assertThat(cmd.getValue().nameQuery()).isEqualTo("Linh");
        assertThat(cmd.getValue().amount()).isEqualByComparingTo("50000");
        assertThat(cmd.getValue().note()).isEqualTo("coffee");
        assertThat(cmd.getValue().kind()).isEqualTo(TxKind.DEBT);
        verify(sender).send(eq(CHAT), contains("Debt recorded for Linh: 50000"));
    }
}
