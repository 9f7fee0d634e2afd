package dev.univer.notoc.bot;

import dev.univer.notoc.config.NotocProperties;
import dev.univer.notoc.exception.AliasConflictException;
import dev.univer.notoc.match.Candidate;
import dev.univer.notoc.match.Resolution;
import dev.univer.notoc.model.Debtor;
import dev.univer.notoc.model.Tx;
import dev.univer.notoc.model.TxKind;
import dev.univer.notoc.model.User;
import dev.univer.notoc.repo.DebtorBalance;
import dev.univer.notoc.service.DeadlineService;
import dev.univer.notoc.service.DebtorResolver;
import dev.univer.notoc.service.DebtorService;
import dev.univer.notoc.service.LedgerService;
import dev.univer.notoc.service.RecordService;
import dev.univer.notoc.service.RecordService.RecordCommand;
import dev.univer.notoc.service.RecordService.RecordOutcome;
import dev.univer.notoc.service.UserService;
import dev.univer.notoc.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.MaybeInaccessibleMessage;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chat adapter: maps commands to the ledger services and renders the three resolution outcomes
 * (exact match, candidates to pick from, nothing found).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DebtBot {

    private final UserService userService;
    private final DebtorResolver resolver;
    private final DebtorService debtorService;
    private final LedgerService ledgerService;
    private final DeadlineService deadlineService;
    private final RecordService recordService;
    private final TelegramSender sender;
    private final NotocProperties props;

    private static final String MENTION_OPT = "(?:@\\w+)?";
    private static final String ARGS_OPT = "(?:\\s+(.+?))?\\s*$";

    private static final Pattern HELP      = Pattern.compile("^/(start|help)" + MENTION_OPT + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ADD       = Pattern.compile("^/add"       + MENTION_OPT + ARGS_OPT, Pattern.CASE_INSENSITIVE);
    private static final Pattern PAID      = Pattern.compile("^/paid"      + MENTION_OPT + ARGS_OPT, Pattern.CASE_INSENSITIVE);
    private static final Pattern BALANCE   = Pattern.compile("^/balance"   + MENTION_OPT + ARGS_OPT, Pattern.CASE_INSENSITIVE);
    private static final Pattern HISTORY   = Pattern.compile("^/history"   + MENTION_OPT + ARGS_OPT, Pattern.CASE_INSENSITIVE);
    private static final Pattern ALIAS     = Pattern.compile("^/alias"     + MENTION_OPT + "\\s+(.+?)\\s*=\\s*(.+?)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LINK      = Pattern.compile("^/link"      + MENTION_OPT + "\\s+(.+?)\\s+(@\\w+)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEADLINE  = Pattern.compile("^/deadline"  + MENTION_OPT + "\\s+(\\d+)\\s+(\\S+)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEADLINES = Pattern.compile("^/deadlines" + MENTION_OPT + "(?:\\s+(\\d+))?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DELTX     = Pattern.compile("^/deltx"     + MENTION_OPT + "\\s+(\\d+)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DELDEBTOR = Pattern.compile("^/deldebtor" + MENTION_OPT + "\\s+(.+?)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DELALL    = Pattern.compile("^/delall"    + MENTION_OPT + "(?:\\s+(confirm))?\\s*$", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> COMMANDS =
            List.of(HELP, ADD, PAID, BALANCE, HISTORY, ALIAS, LINK, DEADLINE, DEADLINES, DELTX, DELDEBTOR, DELALL);

    private static final String CB_DEBTOR = "debtor_";
    private static final String CB_NEW = "new_debtor";

    private static final DateTimeFormatter DATE_DOTS = DateTimeFormatter.ofPattern("dd.MM.yyyy").withZone(ZoneOffset.UTC);

    @EventListener
    public void onUpdate(Update update) {
        try { handle(update); } catch (Exception e) { log.error("Error processing update", e); }
    }

    private void handle(Update update) throws TelegramApiException {
        if (update.hasCallbackQuery()) {
            handleCallback(update.getCallbackQuery());
            return;
        }
        if (!update.hasMessage()) return;
        Message msg = update.getMessage();
        if (!msg.hasText() || msg.getFrom() == null) return;

        Long chatId = msg.getChatId();
        String text = msg.getText().trim();
        if (!isCommand(text)) return;
        org.telegram.telegrambots.meta.api.objects.User from = msg.getFrom();
        User user = userService.getOrCreate(from.getId(), from.getFirstName(), from.getUserName());

        try {
            dispatch(msg, chatId, text, user);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            send(chatId, "❌ " + ex.getMessage());
        }
    }

    private static boolean isCommand(String text) {
        return COMMANDS.stream().anyMatch(p -> p.matcher(text).matches());
    }

    private void dispatch(Message msg, Long chatId, String text, User user) throws TelegramApiException {
        if (HELP.matcher(text).matches()) { send(chatId, helpText()); return; }

        Matcher m = ADD.matcher(text);
        if (m.matches()) { record(msg, user, m.group(1), TxKind.DEBT); return; }
        m = PAID.matcher(text);
        if (m.matches()) { record(msg, user, m.group(1), TxKind.CREDIT); return; }

        m = BALANCE.matcher(text);
        if (m.matches()) {
            if (m.group(1) == null) send(chatId, renderSummary(ledgerService.allBalances(user.getId())));
            else withDebtor(chatId, user, m.group(1), d ->
                    "💰 " + d.getName() + ": " + renderBalance(ledgerService.balance(d.getId())));
            return;
        }

        m = HISTORY.matcher(text);
        if (m.matches()) {
            if (m.group(1) == null) { send(chatId, "Usage: /history <name>"); return; }
            withDebtor(chatId, user, m.group(1), d -> renderHistory(d,
                    ledgerService.history(d.getId(), props.getHistory().getDefaultLimit()),
                    ledgerService.balance(d.getId())));
            return;
        }

        m = ALIAS.matcher(text);
        if (m.matches()) {
            String alias = m.group(1).trim();
            String real = m.group(2).trim();
            try {
                Optional<Debtor> d = debtorService.addAlias(user.getId(), alias, real);
                send(chatId, d.isPresent()
                             ? "✅ \"" + alias + "\" is now a nickname of \"" + d.get().getName() + "\""
                             : "❌ Nobody called \"" + real + "\" in your list.");
            } catch (AliasConflictException ex) {
                send(chatId, "❌ Nickname \"" + ex.getAlias() + "\" is already used for \"" + ex.getTakenBy() + "\".");
            }
            return;
        }

        m = LINK.matcher(text);
        if (m.matches()) {
            DebtorService.LinkResult r = debtorService.link(user.getId(), m.group(1).trim(), m.group(2));
            switch (r.status()) {
                case LINKED -> send(chatId, "✅ " + r.debtor().getName() + " is linked to " + m.group(2)
                                            + ". They will be notified about new entries.");
                case UNKNOWN_HANDLE -> send(chatId, "❌ " + m.group(2) + " has not talked to me yet. Ask them to send /start.");
                case UNKNOWN_DEBTOR -> send(chatId, "❌ Nobody called \"" + m.group(1).trim() + "\" in your list.");
            }
            return;
        }

        m = DEADLINE.matcher(text);
        if (m.matches()) {
            Long txId = Long.parseLong(m.group(1));
            String raw = m.group(2);
            LocalDate date = null;
            if (!"clear".equalsIgnoreCase(raw)) {
                date = ParseUtil.parseFlexibleDate(raw);
                if (date == null) { send(chatId, "Wrong date. Use YYYY-MM-DD or DD.MM.YYYY, or 'clear'."); return; }
            }
            Optional<Tx> tx = deadlineService.setDueDate(user.getId(), txId,
                                                         date == null ? null : ParseUtil.startOfDayUtc(date));
            send(chatId, tx.isEmpty() ? "❌ Transaction not found."
                                      : date == null ? "✅ Due date of #" + txId + " cleared."
                                                     : "✅ #" + txId + " is due " + date.format(DateTimeFormatter.ofPattern("dd.MM.yyyy")));
            return;
        }

        m = DEADLINES.matcher(text);
        if (m.matches()) {
            Integer days = m.group(1) == null ? null : Integer.valueOf(m.group(1));
            List<Tx> due = deadlineService.listUpcoming(user.getId(), props.getDeadlines().getDefaultLimit(), days);
            send(chatId, due.isEmpty() ? "No due dates." : renderDeadlines(due));
            return;
        }

        m = DELTX.matcher(text);
        if (m.matches()) {
            boolean removed = ledgerService.deleteTransaction(user.getId(), Long.parseLong(m.group(1)));
            send(chatId, removed ? "🗑 Transaction #" + m.group(1) + " deleted."
                                 : "❌ Transaction not found.");
            return;
        }

        m = DELDEBTOR.matcher(text);
        if (m.matches()) {
            withDebtor(chatId, user, m.group(1), d -> ledgerService.deleteDebtor(user.getId(), d.getId())
                                                      ? "🗑 " + d.getName() + " and all their history deleted."
                                                      : "❌ Not found.");
            return;
        }

        m = DELALL.matcher(text);
        if (m.matches()) {
            if (m.group(1) == null) {
                send(chatId, "⚠️ This removes all " + ledgerService.countDebtors(user.getId())
                             + " people and their history. Send /delall confirm to proceed.");
                return;
            }
            int removed = ledgerService.deleteAll(user.getId());
            send(chatId, removed == 0 ? "Nothing to delete." : "🗑 Deleted " + removed + " people.");
        }
    }

    private void record(Message msg, User user, String args, TxKind kind) throws TelegramApiException {
        Long chatId = msg.getChatId();
        String usage = kind == TxKind.DEBT ? "Usage: /add <name> <amount> [note]" : "Usage: /paid <name> <amount> [note]";
        if (args == null) { send(chatId, usage); return; }
        String[] tokens = args.split("\\s+");
        org.telegram.telegrambots.meta.api.objects.User from = msg.getFrom();
        Long groupTag = msg.getChat() != null && (msg.getChat().isGroupChat() || msg.getChat().isSuperGroupChat())
                        ? chatId : null;

        // "/add 50k coffee" as a reply to someone's message: the debtor is that account
        org.telegram.telegrambots.meta.api.objects.User target = replyTarget(msg);
        ParseUtil.NameAmountNote direct = target == null ? null : ParseUtil.parseAmountNote(tokens);
        if (direct != null) {
            RecordOutcome outcome = recordService.recordForAccount(new RecordCommand(
                    from.getId(), from.getFirstName(), from.getUserName(), sessionToken(chatId),
                    target.getFirstName(), direct.amount, kind, direct.note, null, groupTag), target.getId());
            send(chatId, renderRecorded(outcome));
            return;
        }

        ParseUtil.NameAmountNote parsed = ParseUtil.parseNameAmountNote(tokens);
        if (parsed == null) { send(chatId, "❌ Name or amount is missing.\n" + usage); return; }

        RecordOutcome outcome = recordService.record(new RecordCommand(
                from.getId(), from.getFirstName(), from.getUserName(), sessionToken(chatId),
                parsed.name, parsed.amount, kind, parsed.note, null, groupTag));

        if (!outcome.isPending()) { send(chatId, renderRecorded(outcome)); return; }

        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        List<Candidate> shown = outcome.candidates().stream().limit(props.getMatch().getMaxCandidates()).toList();
        for (int i = 0; i < shown.size(); i++) {
            Candidate c = shown.get(i);
            rows.add(List.of(InlineKeyboardButton.builder()
                                                 .text((i + 1) + ". " + c.debtor().getName() + " (" + c.score() + "%)")
                                                 .callbackData(CB_DEBTOR + c.debtor().getId())
                                                 .build()));
        }
        rows.add(List.of(InlineKeyboardButton.builder()
                                             .text("➕ New \"" + parsed.name + "\"")
                                             .callbackData(CB_NEW)
                                             .build()));
        sender.send(chatId, "🔍 Similar names found. Who did you mean?",
                    InlineKeyboardMarkup.builder().keyboard(rows).build());
    }

    private static org.telegram.telegrambots.meta.api.objects.User replyTarget(Message msg) {
        Message reply = msg.getReplyToMessage();
        if (reply == null || reply.getFrom() == null) return null;
        org.telegram.telegrambots.meta.api.objects.User target = reply.getFrom();
        if (Boolean.TRUE.equals(target.getIsBot()) || target.getId().equals(msg.getFrom().getId())) return null;
        return target;
    }

    private void handleCallback(CallbackQuery cq) throws TelegramApiException {
        sender.answer(cq.getId());
        MaybeInaccessibleMessage msg = cq.getMessage();
        if (msg == null || cq.getData() == null) return;
        Long chatId = msg.getChatId();
        Long fromId = cq.getFrom().getId();
        String data = cq.getData();

        Optional<RecordOutcome> outcome;
        if (data.startsWith(CB_DEBTOR)) {
            Long debtorId;
            try { debtorId = Long.parseLong(data.substring(CB_DEBTOR.length())); }
            catch (NumberFormatException e) { sender.edit(chatId, msg.getMessageId(), "❌ Invalid choice."); return; }
            outcome = recordService.continueWithDebtor(fromId, sessionToken(chatId), debtorId);
        } else if (CB_NEW.equals(data)) {
            outcome = recordService.continueWithNewDebtor(fromId, sessionToken(chatId));
        } else {
            sender.edit(chatId, msg.getMessageId(), "❌ Invalid choice.");
            return;
        }
        sender.edit(chatId, msg.getMessageId(), outcome.map(this::renderRecorded)
                                                       .orElse("❌ This choice has expired, please send the command again."));
    }

    private interface DebtorReply {
        String apply(Debtor d);
    }

    /** Acts only on an exact resolution; otherwise lists candidates or reports nothing found. */
    private void withDebtor(Long chatId, User user, String name, DebtorReply reply) throws TelegramApiException {
        Resolution r = resolver.resolve(user.getId(), name);
        switch (r.kind()) {
            case ALIAS, NAME -> send(chatId, reply.apply(r.exactMatch()));
            case FUZZY -> {
                StringBuilder sb = new StringBuilder("🔍 No exact match for \"" + name.trim() + "\". Did you mean:\n");
                r.candidates().stream().limit(props.getMatch().getMaxCandidates())
                 .forEach(c -> sb.append("• ").append(c.debtor().getName()).append(" (").append(c.score()).append("%)\n"));
                send(chatId, sb.toString().trim());
            }
            case NONE -> send(chatId, "❌ Nobody called \"" + name.trim() + "\" in your list.");
        }
    }

    private String renderRecorded(RecordOutcome o) {
        Tx tx = o.transaction();
        String note = tx.getNote() == null ? "" : " (" + tx.getNote() + ")";
        String head = tx.getKind() == TxKind.DEBT
                      ? "✅ Debt recorded for " + o.debtor().getName() + ": " + ParseUtil.fmtMoney(tx.getAmount()) + note
                      : "✅ Repayment from " + o.debtor().getName() + ": " + ParseUtil.fmtMoney(tx.getAmount()) + note;
        String out = head + " [#" + tx.getId() + "]\n\n" + renderBalance(o.balance());
        if (!o.allBalances().isEmpty()) out += "\n\n" + renderSummary(o.allBalances());
        return out;
    }

    private static String renderBalance(BigDecimal balance) {
        if (balance.signum() > 0) return "Owes you: " + ParseUtil.fmtMoney(balance);
        if (balance.signum() < 0) return "You owe: " + ParseUtil.fmtMoney(balance.negate());
        return "All settled 🎉";
    }

    private static String renderSummary(List<DebtorBalance> balances) {
        if (balances.isEmpty()) return "No open balances.";
        StringBuilder sb = new StringBuilder("📊 Balances:\n");
        BigDecimal owedToUs = BigDecimal.ZERO;
        BigDecimal weOwe = BigDecimal.ZERO;
        for (DebtorBalance b : balances) {
            sb.append("• ").append(b.debtorName()).append(": ").append(ParseUtil.fmtMoney(b.balance())).append("\n");
            if (b.balance().signum() > 0) owedToUs = owedToUs.add(b.balance());
            else weOwe = weOwe.add(b.balance().negate());
        }
        BigDecimal net = owedToUs.subtract(weOwe);
        sb.append("\nOwed to you: ").append(ParseUtil.fmtMoney(owedToUs))
          .append("\nYou owe: ").append(ParseUtil.fmtMoney(weOwe))
          .append("\nNet: ").append(ParseUtil.fmtMoney(net));
        return sb.toString();
    }

    private static String renderHistory(Debtor d, List<Tx> txs, BigDecimal balance) {
        if (txs.isEmpty()) return "No transactions with " + d.getName() + " yet.";
        StringBuilder sb = new StringBuilder("📜 " + d.getName() + ":\n");
        for (Tx t : txs) {
            sb.append("#").append(t.getId()).append(" ")
              .append(DATE_DOTS.format(t.getCreatedAt())).append(" ")
              .append(t.getKind() == TxKind.DEBT ? "+" : "-").append(ParseUtil.fmtMoney(t.getAmount()));
            if (t.getNote() != null) sb.append(" ").append(t.getNote());
            if (t.getDueDate() != null) sb.append(" ⏰ ").append(DATE_DOTS.format(t.getDueDate()));
            sb.append("\n");
        }
        return sb.append("\n").append(renderBalance(balance)).toString();
    }

    private static String renderDeadlines(List<Tx> due) {
        StringBuilder sb = new StringBuilder("⏰ Due dates:\n");
        for (Tx t : due) {
            sb.append("#").append(t.getId()).append(" ").append(t.getDebtor().getName()).append(" ")
              .append(ParseUtil.fmtMoney(t.getAmount())).append(" → ").append(DATE_DOTS.format(t.getDueDate())).append("\n");
        }
        return sb.toString().trim();
    }

    private static String sessionToken(Long chatId) {
        return "chat:" + chatId;
    }

    private void send(Long chatId, String text) throws TelegramApiException {
        sender.send(chatId, text);
    }

    private String helpText() {
        return String.join("\n", List.of(
                "Hi! I keep track of who owes you money.",
                "",
                "/add <name> <amount> [note] - they owe you more (50k = 50000)",
                "/paid <name> <amount> [note] - they paid back",
                "(reply to someone with /add <amount> [note] to use their account)",
                "/balance [name] - all balances or one person",
                "/history <name> - last entries",
                "/alias <nickname> = <name> - add a nickname",
                "/link <name> @username - notify that person about new entries",
                "/deadline <id> <date|clear> - due date (YYYY-MM-DD or DD.MM.YYYY)",
                "/deadlines [days] - upcoming and overdue",
                "/deltx <id> - delete one entry",
                "/deldebtor <name> - delete a person and their history",
                "/delall - delete everything"
                                        ));
    }
}
