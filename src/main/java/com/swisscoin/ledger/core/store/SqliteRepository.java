package com.swisscoin.ledger.core.store;

import com.swisscoin.ledger.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Single-connection SQLite store. Every public method is synchronized on the repository, so a
 * unit of work passed to {@link #inTransaction} never interleaves with another thread's.
 * <p>
 * Rows written before currencies were recorded come back with the configured default currency.
 */
@org.springframework.stereotype.Repository
public class SqliteRepository implements Repository {

    private static final Logger log = LoggerFactory.getLogger(SqliteRepository.class);

    private final Connection conn;
    private final String defaultCurrency;
    private int txDepth;

    public SqliteRepository(@Value("${app.data.dir}") String dataDir,
                            @Value("${app.currency.default:USD}") String defaultCurrency) {
        this.defaultCurrency = defaultCurrency.trim().toUpperCase(Locale.ROOT);
        try {
            Path dir = Path.of(dataDir);
            Files.createDirectories(dir);
            Path db = dir.resolve("ledger.sqlite");
            conn = DriverManager.getConnection("jdbc:sqlite:" + db);
            log.info("ledger store opened at {}", db);
        } catch (IOException | SQLException e) {
            throw new LedgerDataAccessException("cannot open ledger store in " + dataDir, e);
        }
        init();
    }

    @Override
    public synchronized void init() {
        try (Statement st = conn.createStatement()) {
            st.executeUpdate("CREATE TABLE IF NOT EXISTS participants (" +
                    "id TEXT PRIMARY KEY," +
                    "display_name TEXT," +
                    "deleted INTEGER DEFAULT 0" +
                    ")");
            st.executeUpdate("""
                    CREATE TABLE IF NOT EXISTS transactions (
                      id TEXT PRIMARY KEY,
                      title TEXT NOT NULL,
                      total_amount TEXT NOT NULL,
                      currency TEXT,            -- NULL sur les anciennes lignes
                      ts INTEGER,
                      split_method TEXT,
                      payer_id TEXT,            -- payeur unique (legacy)
                      group_id TEXT,
                      note TEXT,
                      created_by TEXT,
                      deleted INTEGER DEFAULT 0
                    )
                    """);
            st.executeUpdate("CREATE TABLE IF NOT EXISTS transaction_payers (" +
                    "transaction_id TEXT NOT NULL," +
                    "participant_id TEXT NOT NULL," +
                    "amount TEXT NOT NULL," +
                    "position INTEGER," +
                    "PRIMARY KEY(transaction_id, participant_id)" +
                    ")");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS transaction_splits (" +
                    "transaction_id TEXT NOT NULL," +
                    "participant_id TEXT NOT NULL," +
                    "amount TEXT NOT NULL," +
                    "raw_input TEXT," +
                    "position INTEGER," +
                    "PRIMARY KEY(transaction_id, participant_id)" +
                    ")");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS settlements (" +
                    "id TEXT PRIMARY KEY," +
                    "from_id TEXT NOT NULL," +
                    "to_id TEXT NOT NULL," +
                    "amount TEXT NOT NULL," +
                    "currency TEXT," +
                    "ts INTEGER," +
                    "note TEXT," +
                    "full_settlement INTEGER DEFAULT 0," +
                    "group_id TEXT," +
                    "deleted INTEGER DEFAULT 0" +
                    ")");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS user_groups (" +
                    "id TEXT PRIMARY KEY," +
                    "name TEXT," +
                    "deleted INTEGER DEFAULT 0" +
                    ")");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS group_members (" +
                    "group_id TEXT NOT NULL," +
                    "participant_id TEXT NOT NULL," +
                    "position INTEGER," +
                    "PRIMARY KEY(group_id, participant_id)" +
                    ")");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS subscriptions (" +
                    "id TEXT PRIMARY KEY," +
                    "name TEXT," +
                    "amount TEXT NOT NULL," +
                    "currency TEXT," +
                    "cycle TEXT," +
                    "custom_cycle_days INTEGER DEFAULT 0," +
                    "next_billing_date TEXT," +
                    "shared INTEGER DEFAULT 0," +
                    "active INTEGER DEFAULT 1," +
                    "deleted INTEGER DEFAULT 0" +
                    ")");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS subscription_members (" +
                    "subscription_id TEXT NOT NULL," +
                    "participant_id TEXT NOT NULL," +
                    "position INTEGER," +
                    "PRIMARY KEY(subscription_id, participant_id)" +
                    ")");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS subscription_payments (" +
                    "id TEXT PRIMARY KEY," +
                    "subscription_id TEXT NOT NULL," +
                    "payer_id TEXT," +
                    "amount TEXT NOT NULL," +
                    "ts INTEGER," +
                    "note TEXT" +
                    ")");
            st.executeUpdate("CREATE TABLE IF NOT EXISTS subscription_settlements (" +
                    "id TEXT PRIMARY KEY," +
                    "subscription_id TEXT NOT NULL," +
                    "from_id TEXT NOT NULL," +
                    "to_id TEXT NOT NULL," +
                    "amount TEXT NOT NULL," +
                    "ts INTEGER," +
                    "note TEXT" +
                    ")");
        } catch (SQLException e) {
            throw new LedgerDataAccessException("schema init failed", e);
        }
    }

    @Override
    public synchronized <T> T inTransaction(Supplier<T> work) {
        if (txDepth > 0) return work.get();
        try {
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            throw new LedgerDataAccessException("cannot begin transaction", e);
        }
        txDepth++;
        try {
            T result = work.get();
            conn.commit();
            return result;
        } catch (SQLException e) {
            rollback(e);
            throw new LedgerDataAccessException("commit failed", e);
        } catch (RuntimeException e) {
            rollback(e);
            throw e;
        } finally {
            txDepth--;
            try {
                conn.setAutoCommit(true);
            } catch (SQLException e) {
                log.warn("could not restore autocommit: {}", e.getMessage());
            }
        }
    }

    private void rollback(Exception cause) {
        try {
            conn.rollback();
            log.debug("transaction rolled back: {}", cause.toString());
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    // ---------- Participants ----------
    @Override
    public synchronized void upsertParticipant(Participant p) {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO participants(id,display_name,deleted) VALUES(?,?,?) " +
                        "ON CONFLICT(id) DO UPDATE SET display_name=excluded.display_name, deleted=excluded.deleted")) {
            ps.setString(1, p.id());
            ps.setString(2, p.displayName());
            ps.setInt(3, p.deleted() ? 1 : 0);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerDataAccessException("upsert participant " + p.id(), e);
        }
    }

    @Override
    public synchronized Participant findParticipant(String id) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM participants WHERE id=?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return mapParticipant(rs);
                return null;
            }
        } catch (SQLException e) {
            throw new LedgerDataAccessException("find participant " + id, e);
        }
    }

    @Override
    public synchronized List<Participant> listParticipantsActive() {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM participants WHERE deleted=0 ORDER BY display_name COLLATE NOCASE ASC, id ASC")) {
            List<Participant> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(mapParticipant(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new LedgerDataAccessException("list participants", e);
        }
    }

    @Override
    public synchronized void tombstoneParticipant(String id) {
        execute("UPDATE participants SET deleted=1 WHERE id=?", id);
    }

    private Participant mapParticipant(ResultSet rs) throws SQLException {
        return new Participant(rs.getString("id"), rs.getString("display_name"), rs.getInt("deleted") == 1);
    }

    // ---------- Transactions ----------
    @Override
    public synchronized void upsertTransaction(Transaction t) {
        inTransaction(() -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO transactions(id,title,total_amount,currency,ts,split_method,payer_id,group_id,note,created_by,deleted) " +
                            "VALUES(?,?,?,?,?,?,?,?,?,?,?) " +
                            "ON CONFLICT(id) DO UPDATE SET title=excluded.title, total_amount=excluded.total_amount, " +
                            "currency=excluded.currency, ts=excluded.ts, split_method=excluded.split_method, " +
                            "payer_id=excluded.payer_id, group_id=excluded.group_id, note=excluded.note, " +
                            "created_by=excluded.created_by, deleted=excluded.deleted")) {
                ps.setString(1, t.id());
                ps.setString(2, t.title());
                ps.setString(3, t.totalAmount().toPlainString());
                ps.setString(4, currencyOrDefault(t.currencyCode()));
                ps.setLong(5, t.ts());
                ps.setString(6, t.splitMethod() == null ? SplitMethod.EQUAL.name() : t.splitMethod().name());
                ps.setString(7, t.payerId());
                ps.setString(8, t.groupId());
                ps.setString(9, t.note());
                ps.setString(10, t.createdBy());
                ps.setInt(11, t.deleted() ? 1 : 0);
                ps.executeUpdate();
                deleteChildren(t.id());
                insertPayers(t);
                insertSplits(t);
            } catch (SQLException e) {
                throw new LedgerDataAccessException("upsert transaction " + t.id(), e);
            }
            return null;
        });
    }

    private void insertPayers(Transaction t) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO transaction_payers(transaction_id,participant_id,amount,position) VALUES(?,?,?,?)")) {
            int pos = 0;
            for (PayerContribution p : t.payers()) {
                ps.setString(1, t.id());
                ps.setString(2, p.participantId());
                ps.setString(3, p.amount().toPlainString());
                ps.setInt(4, pos++);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertSplits(Transaction t) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO transaction_splits(transaction_id,participant_id,amount,raw_input,position) VALUES(?,?,?,?,?)")) {
            int pos = 0;
            for (SplitShare s : t.splits()) {
                ps.setString(1, t.id());
                ps.setString(2, s.participantId());
                ps.setString(3, s.amount().toPlainString());
                ps.setString(4, s.rawInput() == null ? null : s.rawInput().toPlainString());
                ps.setInt(5, pos++);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void deleteChildren(String transactionId) throws SQLException {
        for (String sql : List.of("DELETE FROM transaction_payers WHERE transaction_id=?",
                "DELETE FROM transaction_splits WHERE transaction_id=?")) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, transactionId);
                ps.executeUpdate();
            }
        }
    }

    @Override
    public synchronized Transaction findTransaction(String id) {
        List<Transaction> found = queryTransactions("SELECT * FROM transactions WHERE id=?", id);
        return found.isEmpty() ? null : found.get(0);
    }

    @Override
    public synchronized List<Transaction> listTransactionsActive() {
        return queryTransactions("SELECT * FROM transactions WHERE deleted=0 ORDER BY ts DESC, id ASC");
    }

    @Override
    public synchronized List<Transaction> listTransactionsInvolving(String participantId) {
        return queryTransactions("""
                SELECT * FROM transactions t WHERE t.deleted=0 AND (
                  t.payer_id=?
                  OR EXISTS (SELECT 1 FROM transaction_payers p WHERE p.transaction_id=t.id AND p.participant_id=?)
                  OR EXISTS (SELECT 1 FROM transaction_splits s WHERE s.transaction_id=t.id AND s.participant_id=?)
                ) ORDER BY t.ts DESC, t.id ASC
                """, participantId, participantId, participantId);
    }

    @Override
    public synchronized List<Transaction> listTransactionsByGroup(String groupId) {
        return queryTransactions("SELECT * FROM transactions WHERE deleted=0 AND group_id=? ORDER BY ts DESC, id ASC", groupId);
    }

    @Override
    public synchronized void tombstoneTransaction(String id) {
        execute("UPDATE transactions SET deleted=1 WHERE id=?", id);
    }

    @Override
    public synchronized void deleteTransaction(String id) {
        inTransaction(() -> {
            try {
                deleteChildren(id);
            } catch (SQLException e) {
                throw new LedgerDataAccessException("delete transaction rows " + id, e);
            }
            execute("DELETE FROM transactions WHERE id=?", id);
            return null;
        });
    }

    private List<Transaction> queryTransactions(String sql, String... args) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) ps.setString(i + 1, args[i]);
            List<Transaction> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(mapTransaction(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new LedgerDataAccessException("query transactions", e);
        }
    }

    private Transaction mapTransaction(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        return new Transaction(
                id,
                rs.getString("title"),
                new BigDecimal(rs.getString("total_amount")),
                currencyOrDefault(rs.getString("currency")),
                rs.getLong("ts"),
                SplitMethod.parse(rs.getString("split_method")),
                rs.getString("payer_id"),
                loadPayers(id),
                loadSplits(id),
                rs.getString("group_id"),
                rs.getString("note"),
                rs.getString("created_by"),
                rs.getInt("deleted") == 1
        );
    }

    private List<PayerContribution> loadPayers(String transactionId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT participant_id, amount FROM transaction_payers WHERE transaction_id=? ORDER BY position ASC")) {
            ps.setString(1, transactionId);
            List<PayerContribution> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(new PayerContribution(rs.getString(1), new BigDecimal(rs.getString(2))));
            }
            return out;
        }
    }

    private List<SplitShare> loadSplits(String transactionId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT participant_id, amount, raw_input FROM transaction_splits WHERE transaction_id=? ORDER BY position ASC")) {
            ps.setString(1, transactionId);
            List<SplitShare> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String raw = rs.getString(3);
                    out.add(new SplitShare(rs.getString(1), new BigDecimal(rs.getString(2)),
                            raw == null ? null : new BigDecimal(raw)));
                }
            }
            return out;
        }
    }

    // ---------- Settlements ----------
    @Override
    public synchronized void insertSettlement(Settlement s) {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO settlements(id,from_id,to_id,amount,currency,ts,note,full_settlement,group_id,deleted) " +
                        "VALUES(?,?,?,?,?,?,?,?,?,?)")) {
            ps.setString(1, s.id());
            ps.setString(2, s.fromParticipantId());
            ps.setString(3, s.toParticipantId());
            ps.setString(4, s.amount().toPlainString());
            ps.setString(5, currencyOrDefault(s.currencyCode()));
            ps.setLong(6, s.ts());
            ps.setString(7, s.note());
            ps.setInt(8, s.fullSettlement() ? 1 : 0);
            ps.setString(9, s.groupId());
            ps.setInt(10, s.deleted() ? 1 : 0);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerDataAccessException("insert settlement " + s.id(), e);
        }
    }

    @Override
    public synchronized List<Settlement> listSettlementsActive() {
        return querySettlements("SELECT * FROM settlements WHERE deleted=0 ORDER BY ts ASC, id ASC");
    }

    @Override
    public synchronized List<Settlement> listSettlementsBetween(String a, String b) {
        return querySettlements("SELECT * FROM settlements WHERE deleted=0 AND " +
                "((from_id=? AND to_id=?) OR (from_id=? AND to_id=?)) ORDER BY ts ASC, id ASC", a, b, b, a);
    }

    @Override
    public synchronized List<Settlement> listSettlementsByGroup(String groupId) {
        return querySettlements("SELECT * FROM settlements WHERE deleted=0 AND group_id=? ORDER BY ts ASC, id ASC", groupId);
    }

    @Override
    public synchronized void tombstoneSettlement(String id) {
        execute("UPDATE settlements SET deleted=1 WHERE id=?", id);
    }

    @Override
    public synchronized void deleteSettlement(String id) {
        execute("DELETE FROM settlements WHERE id=?", id);
    }

    private List<Settlement> querySettlements(String sql, String... args) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) ps.setString(i + 1, args[i]);
            List<Settlement> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Settlement(
                            rs.getString("id"),
                            rs.getString("from_id"),
                            rs.getString("to_id"),
                            new BigDecimal(rs.getString("amount")),
                            currencyOrDefault(rs.getString("currency")),
                            rs.getLong("ts"),
                            rs.getString("note"),
                            rs.getInt("full_settlement") == 1,
                            rs.getString("group_id"),
                            rs.getInt("deleted") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new LedgerDataAccessException("query settlements", e);
        }
    }

    // ---------- Groups ----------
    @Override
    public synchronized void upsertGroup(UserGroup g) {
        inTransaction(() -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO user_groups(id,name,deleted) VALUES(?,?,?) " +
                            "ON CONFLICT(id) DO UPDATE SET name=excluded.name, deleted=excluded.deleted")) {
                ps.setString(1, g.id());
                ps.setString(2, g.name());
                ps.setInt(3, g.deleted() ? 1 : 0);
                ps.executeUpdate();
                execute("DELETE FROM group_members WHERE group_id=?", g.id());
                insertMembers("INSERT INTO group_members(group_id,participant_id,position) VALUES(?,?,?)", g.id(), g.memberIds());
            } catch (SQLException e) {
                throw new LedgerDataAccessException("upsert group " + g.id(), e);
            }
            return null;
        });
    }

    @Override
    public synchronized UserGroup findGroup(String id) {
        List<UserGroup> found = queryGroups("SELECT * FROM user_groups WHERE id=?", id);
        return found.isEmpty() ? null : found.get(0);
    }

    @Override
    public synchronized List<UserGroup> listGroupsActive() {
        return queryGroups("SELECT * FROM user_groups WHERE deleted=0 ORDER BY name COLLATE NOCASE ASC");
    }

    @Override
    public synchronized void tombstoneGroup(String id) {
        execute("UPDATE user_groups SET deleted=1 WHERE id=?", id);
    }

    private List<UserGroup> queryGroups(String sql, String... args) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) ps.setString(i + 1, args[i]);
            List<UserGroup> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String id = rs.getString("id");
                    out.add(new UserGroup(id, rs.getString("name"),
                            loadMembers("SELECT participant_id FROM group_members WHERE group_id=? ORDER BY position ASC", id),
                            rs.getInt("deleted") == 1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new LedgerDataAccessException("query groups", e);
        }
    }

    // ---------- Subscriptions ----------
    @Override
    public synchronized void upsertSubscription(Subscription s) {
        inTransaction(() -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO subscriptions(id,name,amount,currency,cycle,custom_cycle_days,next_billing_date,shared,active,deleted) " +
                            "VALUES(?,?,?,?,?,?,?,?,?,?) " +
                            "ON CONFLICT(id) DO UPDATE SET name=excluded.name, amount=excluded.amount, currency=excluded.currency, " +
                            "cycle=excluded.cycle, custom_cycle_days=excluded.custom_cycle_days, " +
                            "next_billing_date=excluded.next_billing_date, shared=excluded.shared, " +
                            "active=excluded.active, deleted=excluded.deleted")) {
                ps.setString(1, s.id());
                ps.setString(2, s.name());
                ps.setString(3, s.amount().toPlainString());
                ps.setString(4, currencyOrDefault(s.currencyCode()));
                ps.setString(5, s.cycle() == null ? BillingCycle.MONTHLY.name() : s.cycle().name());
                ps.setInt(6, s.customCycleDays());
                ps.setString(7, s.nextBillingDate() == null ? null : s.nextBillingDate().toString());
                ps.setInt(8, s.shared() ? 1 : 0);
                ps.setInt(9, s.active() ? 1 : 0);
                ps.setInt(10, s.deleted() ? 1 : 0);
                ps.executeUpdate();
                execute("DELETE FROM subscription_members WHERE subscription_id=?", s.id());
                insertMembers("INSERT INTO subscription_members(subscription_id,participant_id,position) VALUES(?,?,?)",
                        s.id(), s.subscriberIds());
            } catch (SQLException e) {
                throw new LedgerDataAccessException("upsert subscription " + s.id(), e);
            }
            return null;
        });
    }

    @Override
    public synchronized Subscription findSubscription(String id) {
        List<Subscription> found = querySubscriptions("SELECT * FROM subscriptions WHERE id=?", id);
        return found.isEmpty() ? null : found.get(0);
    }

    @Override
    public synchronized List<Subscription> listSubscriptionsActive() {
        return querySubscriptions("SELECT * FROM subscriptions WHERE deleted=0 ORDER BY name COLLATE NOCASE ASC");
    }

    @Override
    public synchronized void deleteSubscription(String id) {
        inTransaction(() -> {
            execute("DELETE FROM subscription_payments WHERE subscription_id=?", id);
            execute("DELETE FROM subscription_settlements WHERE subscription_id=?", id);
            execute("DELETE FROM subscription_members WHERE subscription_id=?", id);
            execute("DELETE FROM subscriptions WHERE id=?", id);
            return null;
        });
    }

    private List<Subscription> querySubscriptions(String sql, String... args) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) ps.setString(i + 1, args[i]);
            List<Subscription> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String id = rs.getString("id");
                    String next = rs.getString("next_billing_date");
                    String cycle = rs.getString("cycle");
                    out.add(new Subscription(
                            id,
                            rs.getString("name"),
                            new BigDecimal(rs.getString("amount")),
                            currencyOrDefault(rs.getString("currency")),
                            cycle == null ? BillingCycle.MONTHLY : BillingCycle.valueOf(cycle),
                            rs.getInt("custom_cycle_days"),
                            next == null ? null : LocalDate.parse(next),
                            rs.getInt("shared") == 1,
                            rs.getInt("active") == 1,
                            loadMembers("SELECT participant_id FROM subscription_members WHERE subscription_id=? ORDER BY position ASC", id),
                            rs.getInt("deleted") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new LedgerDataAccessException("query subscriptions", e);
        }
    }

    @Override
    public synchronized void insertSubscriptionPayment(SubscriptionPayment p) {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO subscription_payments(id,subscription_id,payer_id,amount,ts,note) VALUES(?,?,?,?,?,?)")) {
            ps.setString(1, p.id());
            ps.setString(2, p.subscriptionId());
            ps.setString(3, p.payerId());
            ps.setString(4, p.amount().toPlainString());
            ps.setLong(5, p.ts());
            ps.setString(6, p.note());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerDataAccessException("insert subscription payment " + p.id(), e);
        }
    }

    @Override
    public synchronized List<SubscriptionPayment> listSubscriptionPayments(String subscriptionId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM subscription_payments WHERE subscription_id=? ORDER BY ts DESC, id ASC")) {
            ps.setString(1, subscriptionId);
            List<SubscriptionPayment> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SubscriptionPayment(
                            rs.getString("id"),
                            rs.getString("subscription_id"),
                            rs.getString("payer_id"),
                            new BigDecimal(rs.getString("amount")),
                            rs.getLong("ts"),
                            rs.getString("note")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new LedgerDataAccessException("list subscription payments " + subscriptionId, e);
        }
    }

    @Override
    public synchronized void insertSubscriptionSettlement(SubscriptionSettlement s) {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO subscription_settlements(id,subscription_id,from_id,to_id,amount,ts,note) VALUES(?,?,?,?,?,?,?)")) {
            ps.setString(1, s.id());
            ps.setString(2, s.subscriptionId());
            ps.setString(3, s.fromParticipantId());
            ps.setString(4, s.toParticipantId());
            ps.setString(5, s.amount().toPlainString());
            ps.setLong(6, s.ts());
            ps.setString(7, s.note());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerDataAccessException("insert subscription settlement " + s.id(), e);
        }
    }

    @Override
    public synchronized List<SubscriptionSettlement> listSubscriptionSettlements(String subscriptionId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM subscription_settlements WHERE subscription_id=? ORDER BY ts ASC, id ASC")) {
            ps.setString(1, subscriptionId);
            List<SubscriptionSettlement> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SubscriptionSettlement(
                            rs.getString("id"),
                            rs.getString("subscription_id"),
                            rs.getString("from_id"),
                            rs.getString("to_id"),
                            new BigDecimal(rs.getString("amount")),
                            rs.getLong("ts"),
                            rs.getString("note")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new LedgerDataAccessException("list subscription settlements " + subscriptionId, e);
        }
    }

    // ---------- Helpers ----------
    private String currencyOrDefault(String code) {
        return code == null || code.isBlank() ? defaultCurrency : code;
    }

    private void execute(String sql, String arg) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, arg);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerDataAccessException(sql, e);
        }
    }

    private void insertMembers(String sql, String ownerId, List<String> memberIds) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int pos = 0;
            for (String m : memberIds) {
                ps.setString(1, ownerId);
                ps.setString(2, m);
                ps.setInt(3, pos++);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private List<String> loadMembers(String sql, String ownerId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, ownerId);
            List<String> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(rs.getString(1));
            }
            return out;
        }
    }
}
