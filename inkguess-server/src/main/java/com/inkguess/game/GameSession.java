package com.inkguess.game;

import com.inkguess.protocol.DrawOp;
import com.inkguess.protocol.Message;
import com.inkguess.protocol.MessageBus;
import com.inkguess.protocol.Messages;
import com.inkguess.session.ClientSession;
import com.inkguess.session.ConnectionRegistry;
import com.inkguess.state.GamePhase;
import com.inkguess.state.HistoryBuffer;
import com.inkguess.state.Player;
import com.inkguess.state.RoundState;
import com.inkguess.state.ScoreBoard;
import com.inkguess.store.StoreException;
import com.inkguess.store.UserRecord;
import com.inkguess.store.UserStore;
import com.inkguess.store.WordStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * The game session state machine.
 *
 * Game lifecycle:
 * <pre>
 *   IDLE --startGame--> CHOOSING_WORD --word picked / timeout--> PLAYING
 *        ^                    ^                                    |
 *        |                    +--------- COOLDOWN <--endRound------+
 *        +--endGame (rotations done, quorum lost, word lookup failed)
 * </pre>
 *
 * Threading Model:
 * - Every public method must run on the game loop, a single thread shared with the
 *   {@link Scheduler} ticks, so no state here is synchronized
 * - Store lookups complete on other threads and are handed back to the loop with
 *   {@code whenCompleteAsync(.., loop)}; results are checked against the transition
 *   epoch and dropped when stale
 * - Exactly one timer is live; every transition starting a timer cancels the old one
 */
public class GameSession {

    private static final Logger logger = LoggerFactory.getLogger(GameSession.class);

    public static final int QUORUM = 2;
    public static final int DEFAULT_MAX_ROUNDS = 3;

    public static final int CHOOSE_TIME = 20;
    public static final int ROUND_TIME = 80;
    public static final int COOLDOWN_TIME = 5;
    public static final int INTERMISSION_TIME = 20;

    public static final int MIN_WORD_CHOICES = 3;
    public static final int MAX_WORD_CHOICES = 9;
    public static final long WORD_FETCH_TIMEOUT_SECONDS = 5;

    /** A correct guess cuts the remaining time by SQUEEZE_STEP, never below SQUEEZE_FLOOR. */
    public static final int SQUEEZE_STEP = 5;
    public static final int SQUEEZE_FLOOR = 10;
    public static final int CLOSE_CALL_TIME = 10;

    public static final String SYSTEM_SENDER = "System";
    public static final String NOTE_COLOR = "#607d8b";
    public static final String SUCCESS_COLOR = "#2e7d32";
    public static final String CLOSE_COLOR = "#f9a825";
    public static final String ERROR_COLOR = "#c62828";
    public static final String DEFAULT_CHAT_COLOR = "#000000";

    private final ConnectionRegistry registry;
    private final MessageBus bus;
    private final Scheduler scheduler;
    private final Executor loop;
    private final WordStore wordStore;
    private final UserStore userStore;
    private final HintGenerator hints;
    private final Random random;
    private final int maxRounds;

    // Insertion order is the drawer rotation order
    private final Map<String, Player> players = new LinkedHashMap<>();
    private final ScoreBoard scoreBoard = new ScoreBoard();
    private final HistoryBuffer<DrawOp> drawHistory = new HistoryBuffer<>(HistoryBuffer.DRAW_CAPACITY);
    private final HistoryBuffer<Message> chatHistory = new HistoryBuffer<>(HistoryBuffer.CHAT_CAPACITY);
    private final Set<String> drawnThisRotation = new LinkedHashSet<>();

    private GamePhase phase = GamePhase.IDLE;
    private RoundState round;
    private TimerHandle timer;
    private String gameId;
    private int roundsPlayed;
    private long epoch;

    private GameSession(Builder builder) {
        this.registry = builder.registry;
        this.bus = builder.bus;
        this.scheduler = builder.scheduler;
        this.loop = builder.loop;
        this.wordStore = builder.wordStore;
        this.userStore = builder.userStore;
        this.hints = builder.hints;
        this.random = builder.random;
        this.maxRounds = builder.maxRounds;
    }

    // === Client events ===

    /**
     * Resolves the login token and, once the lookup completes, lets the player in.
     * Unknown tokens are dropped silently; the connection stays unauthenticated.
     */
    public void onHandshake(ClientSession session, String token) {
        CompletableFuture<Optional<UserRecord>> lookup;
        try {
            lookup = userStore.findByToken(token);
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }
        lookup.whenCompleteAsync((user, error) -> completeHandshake(session, user, error), loop);
    }

    public void onDraw(ClientSession session, DrawOp op) {
        String name = registry.identityOf(session);
        if (name == null) {
            logger.debug("Dropping draw from unauthenticated session {}", session.getSessionId());
            return;
        }
        boolean allowed = phase == GamePhase.IDLE
                || (phase == GamePhase.PLAYING && round != null && round.isDrawer(name));
        if (!allowed) {
            logger.debug("Dropping draw from {} during {}", name, phase);
            return;
        }

        switch (op.kind()) {
            case CLEAR -> drawHistory.clear();
            case STROKE -> drawHistory.append(op);
        }
        bus.broadcastExcept(name, Messages.draw(op));
    }

    /**
     * Handles a chat line, which doubles as a guess while a round is being played.
     *
     * @param claimedSender the sender named in the payload; the session's identity wins
     */
    public void onChat(ClientSession session, String claimedSender, String text, String color) {
        String name = registry.identityOf(session);
        if (name == null) {
            logger.debug("Dropping chat from unauthenticated session {}", session.getSessionId());
            return;
        }
        if (claimedSender != null && !claimedSender.equals(name)) {
            logger.warn("Chat sender mismatch: payload claims {} but session belongs to {}", claimedSender, name);
        }
        if (text == null || text.isBlank()) {
            return;
        }
        String line = text.trim();

        if (isGuessing() && GuessMatcher.isExact(line, round.getWord())) {
            Player player = players.get(name);
            if (player != null && !round.isDrawer(name) && !player.hasGuessed()) {
                acceptGuess(name);
            } else {
                // Drawer or a player who already guessed; relaying would give the word away
                logger.debug("Withholding the word typed by {}", name);
            }
            return;
        }

        if (isGuessing() && !round.isDrawer(name) && !hasGuessed(name)) {
            hintCloseness(name, line);
        }

        Message chat = Messages.chat(name, line, color != null && !color.isBlank() ? color : DEFAULT_CHAT_COLOR);
        chatHistory.append(chat);
        bus.broadcastExcept(name, chat);
    }

    public void onWordChosen(ClientSession session, String word) {
        String name = registry.identityOf(session);
        if (name == null || phase != GamePhase.CHOOSING_WORD || round == null || !round.isDrawer(name)) {
            logger.debug("Ignoring word choice from {} during {}", name, phase);
            return;
        }
        String chosen = round.matchCandidate(word);
        if (chosen == null) {
            bus.send(session, Messages.error("Not one of the offered words"));
            return;
        }
        startRound(chosen);
    }

    public void onDisconnect(ClientSession session) {
        String name = registry.unbind(session);
        if (name == null) {
            // Unauthenticated, or evicted by a newer login of the same player
            return;
        }
        players.remove(name);
        scoreBoard.remove(name);
        bus.broadcast(Messages.playerDisconnected(name));
        logger.info("Player {} disconnected ({} players)", name, players.size());

        if (phase == GamePhase.IDLE) {
            return;
        }
        if (players.size() < QUORUM) {
            endGame();
            return;
        }
        if (round != null && round.isDrawer(name)
                && (phase == GamePhase.CHOOSING_WORD || phase == GamePhase.PLAYING)) {
            endRound();
            return;
        }
        if (isGuessing() && allGuessed()) {
            endRound();
        }
    }

    // === Join / resync ===

    private void completeHandshake(ClientSession session, Optional<UserRecord> user, Throwable error) {
        if (error != null) {
            logger.warn("Token lookup failed for session {}", session.getSessionId(), error);
            return;
        }
        if (user == null || user.isEmpty()) {
            logger.warn("Unknown or expired token from session {}", session.getSessionId());
            return;
        }
        if (!session.isActive()) {
            logger.debug("Session {} closed before its handshake completed", session.getSessionId());
            return;
        }
        join(session, user.get());
    }

    private void join(ClientSession session, UserRecord user) {
        String name = user.getIdentity();
        String current = registry.identityOf(session);
        if (current != null && !current.equals(name)) {
            logger.warn("Session {} is already logged in as {}, ignoring handshake as {}",
                    session.getSessionId(), current, name);
            bus.send(session, Messages.error("Already logged in as " + current));
            return;
        }
        int before = players.size();

        registry.bind(name, session);
        if (!players.containsKey(name)) {
            boolean guessedThisRound = isGuessing() && round.hasGuessed(name);
            players.put(name, Player.joined(name).withGuessed(guessedThisRound));
            boolean sameGame = gameId != null && gameId.equals(user.getLastGameId());
            scoreBoard.restore(name, sameGame ? user.getScore() : 0);
        }

        bus.send(session, Messages.handshake(name));
        for (DrawOp op : drawHistory.snapshot()) {
            bus.send(session, Messages.draw(op));
        }
        for (Message chat : chatHistory.snapshot()) {
            bus.send(session, chat);
        }
        for (String existing : players.keySet()) {
            bus.send(session, playerMessage(existing));
        }
        bus.broadcastExcept(name, playerMessage(name));
        syncRound(session, name);

        logger.info("Player {} joined ({} players, phase {})", name, players.size(), phase);

        if (phase == GamePhase.IDLE && before < QUORUM && players.size() >= QUORUM) {
            startGame();
        }
    }

    private void syncRound(ClientSession session, String name) {
        if (round == null) {
            return;
        }
        if (phase == GamePhase.PLAYING) {
            scoreBoard.addToRound(name);
            String shown = round.isDrawer(name) ? round.getWord() : round.getMask();
            bus.send(session, Messages.startRound(round.getDrawer(), shown, round.getRoundNumber()));
            bus.send(session, Messages.timer(round.getRemainingTime()));
        } else if (phase == GamePhase.CHOOSING_WORD) {
            if (round.isDrawer(name) && !round.getCandidates().isEmpty()) {
                bus.send(session, Messages.wordChoices(round.getCandidates()));
            } else {
                bus.send(session, Messages.chat(SYSTEM_SENDER, round.getDrawer() + " is choosing a word", NOTE_COLOR));
            }
        }
    }

    // === Transitions ===

    public void startGame() {
        if (players.size() < QUORUM) {
            logger.debug("Not starting a game with {} players", players.size());
            return;
        }
        cancelTimer();
        gameId = UUID.randomUUID().toString();
        roundsPlayed = 0;
        drawnThisRotation.clear();
        scoreBoard.resetForGame(players.keySet());
        players.replaceAll((name, player) -> player.withGuessed(false));

        for (String name : players.keySet()) {
            bus.broadcast(playerMessage(name));
            persist(name);
        }
        announce("A new game is starting!", NOTE_COLOR);
        logger.info("Game {} started with {} players", gameId, players.size());

        prepareRound();
    }

    private void prepareRound() {
        if (players.size() < QUORUM) {
            endGame();
            return;
        }
        String next = null;
        for (String name : players.keySet()) {
            if (!drawnThisRotation.contains(name)) {
                next = name;
                break;
            }
        }
        if (next == null) {
            drawnThisRotation.clear();
            roundsPlayed++;
            if (roundsPlayed >= maxRounds) {
                endGame();
            } else {
                prepareRound();
            }
            return;
        }

        cancelTimer();
        phase = GamePhase.CHOOSING_WORD;
        round = new RoundState(next, roundsPlayed + 1);
        long expected = ++epoch;
        String drawer = next;
        int count = MIN_WORD_CHOICES + random.nextInt(MAX_WORD_CHOICES - MIN_WORD_CHOICES + 1);

        logger.debug("Round {}: {} draws, fetching {} words", round.getRoundNumber(), drawer, count);
        fetchWords(count).whenCompleteAsync((words, error) -> offerWords(expected, drawer, words, error), loop);
    }

    private CompletableFuture<List<String>> fetchWords(int count) {
        CompletableFuture<List<String>> lookup;
        try {
            lookup = wordStore.fetchRandomWords(true, count);
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }
        return lookup.orTimeout(WORD_FETCH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private void offerWords(long expected, String drawer, List<String> words, Throwable error) {
        if (expected != epoch || phase != GamePhase.CHOOSING_WORD || round == null || !round.isDrawer(drawer)) {
            logger.debug("Ignoring stale word list for {}", drawer);
            return;
        }
        if (error != null || words == null || words.isEmpty()) {
            Throwable cause = error != null ? error : new StoreException("Word store returned no words");
            logger.error("Word lookup failed, ending game {}", gameId, cause);
            announce("Could not fetch words to draw, the game is over.", ERROR_COLOR);
            endGame();
            return;
        }

        RoundState current = round;
        current.setCandidates(words);
        bus.send(drawer, Messages.wordChoices(current.getCandidates()));
        announce(drawer + " is choosing a word", NOTE_COLOR);
        startCountdown(CHOOSE_TIME, () -> startRound(current.getCandidates().get(0)));
    }

    private void startRound(String word) {
        cancelTimer();
        phase = GamePhase.PLAYING;
        RoundState current = round;
        current.setWord(word);
        current.setMask(hints.buildMask(word, current.getHintsShown()));
        current.setGuessingTime(ROUND_TIME);
        current.setRemainingTime(ROUND_TIME);

        players.replaceAll((name, player) -> player.withGuessed(false));
        scoreBoard.beginRound(players.keySet());
        drawHistory.clear();
        bus.broadcast(Messages.draw(DrawOp.clear()));

        for (String name : players.keySet()) {
            String shown = current.isDrawer(name) ? word : current.getMask();
            bus.send(name, Messages.startRound(current.getDrawer(), shown, current.getRoundNumber()));
            bus.broadcast(playerMessage(name));
        }
        logger.info("Round {} of game {} started, {} is drawing ({} letters)",
                current.getRoundNumber(), gameId, current.getDrawer(), HintGenerator.letterCount(word));

        startTimer(elapsed -> tickRound(current, elapsed), this::endRound);
    }

    private boolean tickRound(RoundState current, int elapsed) {
        int remaining = current.getGuessingTime() - elapsed;
        current.setRemainingTime(Math.max(remaining, 0));
        bus.broadcast(Messages.timer(current.getRemainingTime()));
        revealHintIfDue(current);
        return remaining <= 0;
    }

    private void revealHintIfDue(RoundState current) {
        String word = current.getWord();
        int max = hints.maxHints(word);
        if (!hints.shouldReveal(current.getRemainingTime(), current.getHintsShown().size(), max)) {
            return;
        }
        current.setHintsShown(hints.revealNext(word, current.getHintsShown()));
        current.setMask(hints.buildMask(word, current.getHintsShown()));

        Message hint = Messages.word(current.getMask());
        for (String name : players.keySet()) {
            if (!current.isDrawer(name)) {
                bus.send(name, hint);
            }
        }
    }

    private void endRound() {
        if (round == null) {
            return;
        }
        cancelTimer();
        RoundState finished = round;
        String drawer = finished.getDrawer();
        phase = GamePhase.COOLDOWN;
        round = null;
        drawnThisRotation.add(drawer);

        int totalGuessers = 0;
        int guessed = 0;
        for (Player player : players.values()) {
            if (!player.getName().equals(drawer)) {
                totalGuessers++;
                if (player.hasGuessed()) {
                    guessed++;
                }
            }
        }

        if (finished.hasWord()) {
            if (players.containsKey(drawer)) {
                scoreBoard.creditRound(drawer, scoreBoard.drawerPayout(guessed, totalGuessers));
                bus.broadcast(playerMessage(drawer));
                persist(drawer);
            }
            bus.broadcast(Messages.endRound(finished.getWord(), scoreBoard.roundLedger()));
            announce(String.format("The word was %s (%d/%d guessed)", finished.getWord(), guessed, totalGuessers),
                    recapColor(guessed, totalGuessers));
        } else {
            announce("Round skipped, " + drawer + " did not pick a word", NOTE_COLOR);
        }
        logger.info("Round {} of game {} ended, {}/{} guessed",
                finished.getRoundNumber(), gameId, guessed, totalGuessers);

        startCountdown(COOLDOWN_TIME, () -> {
            if (players.size() >= QUORUM) {
                prepareRound();
            } else {
                endGame();
            }
        });
    }

    private void endGame() {
        cancelTimer();
        phase = GamePhase.IDLE;
        round = null;
        epoch++;

        bus.broadcast(Messages.gameOver());
        String leader = scoreBoard.leader();
        if (leader != null && players.containsKey(leader)) {
            announce("Game over! " + leader + " wins with " + scoreBoard.total(leader) + " points", NOTE_COLOR);
        } else {
            announce("Game over!", NOTE_COLOR);
        }
        logger.info("Game {} over after {} rotations", gameId, roundsPlayed);

        startCountdown(INTERMISSION_TIME, () -> {
            if (players.size() >= QUORUM) {
                startGame();
            }
        });
    }

    // === Guessing ===

    private void acceptGuess(String name) {
        int score = scoreBoard.scoreGuess(name, round.getRemainingTime());
        players.put(name, players.get(name).withGuessed(true));
        round.markGuessed(name);

        bus.send(name, Messages.chat(SYSTEM_SENDER, "You guessed the word! +" + score, SUCCESS_COLOR));
        Message note = Messages.chat(SYSTEM_SENDER, name + " guessed the word!", SUCCESS_COLOR);
        chatHistory.append(note);
        bus.broadcastExcept(name, note);
        bus.broadcast(playerMessage(name));
        squeezeRound();
        persist(name);

        logger.debug("{} guessed the word for {} points", name, score);
        if (allGuessed()) {
            endRound();
        }
    }

    private void squeezeRound() {
        int remaining = round.getRemainingTime();
        if (remaining <= SQUEEZE_FLOOR) {
            return;
        }
        int cut = Math.min(SQUEEZE_STEP, remaining - SQUEEZE_FLOOR);
        round.setGuessingTime(round.getGuessingTime() - cut);
        round.setRemainingTime(remaining - cut);
        bus.broadcast(Messages.timer(round.getRemainingTime()));
    }

    private void hintCloseness(String name, String guess) {
        int distance = GuessMatcher.distance(guess, round.getWord());
        if (distance == 1) {
            bus.send(name, Messages.chat(SYSTEM_SENDER, "'" + guess + "' is very close!", CLOSE_COLOR));
        } else if (distance == 2 && round.getRemainingTime() <= CLOSE_CALL_TIME) {
            bus.send(name, Messages.chat(SYSTEM_SENDER, "'" + guess + "' is kinda close!", CLOSE_COLOR));
        }
    }

    private boolean isGuessing() {
        return phase == GamePhase.PLAYING && round != null && round.hasWord();
    }

    private boolean hasGuessed(String name) {
        Player player = players.get(name);
        return player != null && player.hasGuessed();
    }

    private boolean allGuessed() {
        for (Player player : players.values()) {
            if (!round.isDrawer(player.getName()) && !player.hasGuessed()) {
                return false;
            }
        }
        return true;
    }

    // === Helpers ===

    private void startCountdown(int units, Runnable onDone) {
        startTimer(elapsed -> {
            int remaining = units - elapsed;
            bus.broadcast(Messages.timer(Math.max(remaining, 0)));
            return remaining <= 0;
        }, onDone);
    }

    private void startTimer(TickCallback tick, Runnable onDone) {
        cancelTimer();
        timer = scheduler.start(tick, onDone);
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
    }

    private void announce(String text, String color) {
        Message note = Messages.chat(SYSTEM_SENDER, text, color);
        chatHistory.append(note);
        bus.broadcast(note);
    }

    private Message playerMessage(String name) {
        return Messages.player(name, scoreBoard.total(name), hasGuessed(name));
    }

    private void persist(String name) {
        int score = scoreBoard.total(name);
        CompletableFuture<Void> save;
        try {
            save = userStore.persistScore(name, score, gameId);
        } catch (RuntimeException e) {
            save = CompletableFuture.failedFuture(e);
        }
        save.whenComplete((ignored, error) -> {
            if (error != null) {
                logger.warn("Failed to persist score {} for {}", score, name, error);
            }
        });
    }

    /**
     * Red when nobody guessed, green when everybody did.
     */
    static String recapColor(int guessed, int total) {
        double ratio = total == 0 ? 0 : (double) guessed / total;
        int red = (int) Math.round(255 * (1 - ratio));
        int green = (int) Math.round(255 * ratio);
        return String.format("#%02x%02x00", red, green);
    }

    // === State Retrieval ===

    public GamePhase getPhase() {
        return phase;
    }

    public RoundState getRound() {
        return round;
    }

    public Map<String, Player> getPlayers() {
        return Collections.unmodifiableMap(players);
    }

    public ScoreBoard getScoreBoard() {
        return scoreBoard;
    }

    public HistoryBuffer<DrawOp> getDrawHistory() {
        return drawHistory;
    }

    public HistoryBuffer<Message> getChatHistory() {
        return chatHistory;
    }

    public Set<String> getDrawnThisRotation() {
        return Collections.unmodifiableSet(drawnThisRotation);
    }

    public String getGameId() {
        return gameId;
    }

    public int getRoundsPlayed() {
        return roundsPlayed;
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    public boolean hasActiveTimer() {
        return timer != null && timer.isActive();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ConnectionRegistry registry;
        private MessageBus bus;
        private Scheduler scheduler;
        private Executor loop;
        private WordStore wordStore;
        private UserStore userStore;
        private HintGenerator hints = new HintGenerator();
        private Random random = new Random();
        private int maxRounds = DEFAULT_MAX_ROUNDS;

        public Builder registry(ConnectionRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder bus(MessageBus bus) {
            this.bus = bus;
            return this;
        }

        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * The executor store completions are handed back to; must be the game loop.
         */
        public Builder loop(Executor loop) {
            this.loop = loop;
            return this;
        }

        public Builder wordStore(WordStore wordStore) {
            this.wordStore = wordStore;
            return this;
        }

        public Builder userStore(UserStore userStore) {
            this.userStore = userStore;
            return this;
        }

        public Builder hints(HintGenerator hints) {
            this.hints = hints;
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder maxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
            return this;
        }

        public GameSession build() {
            if (registry == null || bus == null || scheduler == null || loop == null
                    || wordStore == null || userStore == null) {
                throw new IllegalStateException("GameSession requires registry, bus, scheduler, loop and stores");
            }
            if (maxRounds < 1) {
                throw new IllegalArgumentException("maxRounds must be at least 1: " + maxRounds);
            }
            return new GameSession(this);
        }
    }
}
