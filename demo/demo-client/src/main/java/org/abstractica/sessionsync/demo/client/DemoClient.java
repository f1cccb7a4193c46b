package org.abstractica.sessionsync.demo.client;

import org.abstractica.sessionsync.ChannelConfig;
import org.abstractica.sessionsync.ConnectionState;
import org.abstractica.sessionsync.CredentialProvider;
import org.abstractica.sessionsync.impl.connection.DefaultConnectionRegistry;
import org.abstractica.sessionsync.impl.session.SessionNavigator;
import org.abstractica.sessionsync.impl.session.SessionProtocolHandler;
import org.abstractica.sessionsync.impl.session.SessionStateStore;
import org.abstractica.sessionsync.impl.session.SessionSyncClient;
import org.abstractica.sessionsync.model.ExerciseItem;
import org.abstractica.sessionsync.model.ExerciseItemType;
import org.abstractica.sessionsync.model.ExerciseSet;
import org.abstractica.sessionsync.model.Participant;
import org.abstractica.sessionsync.model.SessionDocument;
import org.abstractica.sessionsync.model.SessionState;
import org.abstractica.sessionsync.model.SetMetrics;
import org.abstractica.sessionsync.model.SetType;
import org.abstractica.sessionsync.model.Weight;
import org.abstractica.sessionsync.model.WeightUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Console client for a shared exercise session.
 *
 * <p>Features demonstrated:</p>
 * <ul>
 *   <li>Registry and channel configuration</li>
 *   <li>Connection status observation</li>
 *   <li>Joining a session and receiving its state</li>
 *   <li>Optimistic local edits shared with other participants</li>
 *   <li>Offline sessions</li>
 * </ul>
 */
public class DemoClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DemoClient.class);
    private static final String DEFAULT_BASE_URL = "http://localhost:8000";
    private static final String BASE_URL_ENV = "SESSIONSYNC_BASE_URL";
    private static final String TOKEN_ENV = "SESSIONSYNC_TOKEN";

    private final DefaultConnectionRegistry registry;
    private final SessionStateStore store;
    private final SessionSyncClient client;
    private final Disposable statusWatch;

    public DemoClient(String baseUrl, CredentialProvider credentials)
    {
        this.registry = DefaultConnectionRegistry.builder()
                .baseUrl(baseUrl)
                .credentials(credentials)
                .channel(ChannelConfig.exerciseSession())
                .build();
        this.store = new SessionStateStore();

        SessionProtocolHandler handler = new SessionProtocolHandler(store);
        handler.onError((message, exception) ->
                LOG.warn("Dropped {}: {}", message.type().getWireName(), exception.getMessage()));

        this.client = new SessionSyncClient(registry, ChannelConfig.EXERCISE_SESSION, store, handler);

        registerStoreListeners();
        this.statusWatch = registry.observeConnectionState(ChannelConfig.EXERCISE_SESSION)
                .subscribe(state -> System.out.println("Connection: " + formatState(state)));
    }

    private void registerStoreListeners()
    {
        store.onSessionChanged((previous, current) ->
        {
            if (current == null)
            {
                System.out.println("Session closed");
                return;
            }
            System.out.printf("Session '%s' (%s), participants: %s%n",
                    current.name(), current.status(), formatParticipants(current));
        });

        store.onStateChanged((previous, current) ->
        {
            if (current != null && (previous == null || previous.version() != current.version()))
            {
                System.out.printf("State version %d, %d exercise(s)%n", current.version(), current.items().size());
            }
        });

        store.onStatusReport(status ->
        {
            if (status.error() != null)
            {
                System.out.println("Server error: " + status.error());
            }
            else
            {
                System.out.println("Server status: " + status.status());
            }
        });
    }

    private static String formatParticipants(SessionDocument document)
    {
        List<String> names = new ArrayList<>();
        for (Participant participant : document.participants())
        {
            names.add(participant.id() + " " + participant.color());
        }
        return String.join(", ", names);
    }

    private static String formatState(ConnectionState state)
    {
        if (state instanceof ConnectionState.Failed failed)
        {
            return "failed (" + failed.reason() + ")";
        }
        return state.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    }

    public void connect()
    {
        System.out.println("Connecting to server...");
        client.start().whenComplete((ignored, error) ->
        {
            if (error != null)
            {
                System.out.println("Connect failed: " + error.getMessage());
            }
            else
            {
                System.out.println("Commands: join <session>, offline <account> <name>, add <name> <sets>, "
                        + "toggle <exercise> <set>, reps <exercise> <set> <reps> <kg>, show, next, sync, leave, quit");
            }
        });
    }

    public void runCommandLoop()
    {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                String[] parts = line.trim().split("\\s+");
                String command = parts[0].toLowerCase(Locale.ROOT);

                switch (command)
                {
                    case "join" ->
                    {
                        if (parts.length == 2)
                        {
                            client.join(parts[1]);
                        }
                        else
                        {
                            System.out.println("Usage: join <session>");
                        }
                    }
                    case "offline" ->
                    {
                        if (parts.length >= 3)
                        {
                            store.createOfflineSession(parts[1], parts[2]).join();
                        }
                        else
                        {
                            System.out.println("Usage: offline <account> <name>");
                        }
                    }
                    case "add" ->
                    {
                        if (parts.length == 3)
                        {
                            handleAddCommand(parts[1], parts[2]);
                        }
                        else
                        {
                            System.out.println("Usage: add <name> <sets>");
                        }
                    }
                    case "toggle" ->
                    {
                        if (parts.length == 3)
                        {
                            client.toggleSetComplete(parts[1], parts[2]);
                        }
                        else
                        {
                            System.out.println("Usage: toggle <exercise> <set>");
                        }
                    }
                    case "reps" ->
                    {
                        if (parts.length == 5)
                        {
                            handleRepsCommand(parts);
                        }
                        else
                        {
                            System.out.println("Usage: reps <exercise> <set> <reps> <kg>");
                        }
                    }
                    case "show" -> printState();
                    case "next" -> printNext();
                    case "sync" -> client.requestSync();
                    case "leave" -> client.leave();
                    case "quit", "exit", "q" ->
                    {
                        System.out.println("Disconnecting...");
                        return;
                    }
                    case "help" ->
                    {
                        System.out.println("Commands:");
                        System.out.println("  join <session>                   - Join a session");
                        System.out.println("  offline <account> <name>         - Start a session without the server");
                        System.out.println("  add <name> <sets>                - Add an exercise with n sets");
                        System.out.println("  toggle <exercise> <set>          - Toggle a set complete");
                        System.out.println("  reps <exercise> <set> <reps> <kg> - Record a set");
                        System.out.println("  show                             - Print the session");
                        System.out.println("  next                             - Print the next incomplete set");
                        System.out.println("  sync                             - Request a full snapshot");
                        System.out.println("  leave                            - Leave the session");
                        System.out.println("  quit                             - Disconnect and exit");
                    }
                    case "" ->
                    {
                        // Ignore empty input
                    }
                    default -> System.out.println("Unknown command: " + command + " (type 'help' for commands)");
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
    }

    private void handleAddCommand(String name, String setCount)
    {
        int count;
        try
        {
            count = Integer.parseInt(setCount);
        }
        catch (NumberFormatException e)
        {
            System.out.println("Invalid set count. Usage: add <name> <sets>");
            return;
        }

        String exerciseId = name.toLowerCase(Locale.ROOT) + "-" + UUID.randomUUID().toString().substring(0, 8);
        List<ExerciseSet> sets = new ArrayList<>();
        for (int i = 1; i <= count; i++)
        {
            sets.add(new ExerciseSet("s" + i, i, SetType.WORKING, false, SetMetrics.EMPTY));
        }
        ExerciseItem item = new ExerciseItem(exerciseId, 0, List.of(), ExerciseItemType.SINGLE, 90, List.of(), sets);
        client.addExercise(item).thenAccept(changed ->
        {
            if (changed.isEmpty())
            {
                System.out.println("No session loaded");
            }
            else
            {
                System.out.println("Added " + exerciseId);
            }
        });
    }

    private void handleRepsCommand(String[] parts)
    {
        try
        {
            int reps = Integer.parseInt(parts[3]);
            double kilograms = Double.parseDouble(parts[4]);
            SetMetrics metrics = new SetMetrics(reps, new Weight(kilograms, WeightUnit.KILOGRAM), null, null);
            client.updateMetrics(parts[1], parts[2], metrics);
        }
        catch (NumberFormatException e)
        {
            System.out.println("Invalid numbers. Usage: reps <exercise> <set> <reps> <kg>");
        }
    }

    private void printState()
    {
        Optional<SessionState> state = store.getState();
        if (state.isEmpty())
        {
            System.out.println("No session loaded");
            return;
        }
        SessionNavigator navigator = new SessionNavigator(state.get());
        for (ExerciseItem exercise : navigator.sortedExercises())
        {
            System.out.printf("%d. %s%s%n", exercise.order(), exercise.id(),
                    SessionNavigator.isComplete(exercise) ? " (done)" : "");
            for (ExerciseSet set : SessionNavigator.sortedSets(exercise))
            {
                System.out.printf("     %s %-8s %s %s%n", set.complete() ? "[x]" : "[ ]",
                        set.id(), set.type().name().toLowerCase(Locale.ROOT), formatMetrics(set.metrics()));
            }
        }
        SessionNavigator.Progress progress = navigator.progress();
        System.out.printf("%d/%d sets complete%n", progress.completed(), progress.total());
    }

    private void printNext()
    {
        Optional<SessionNavigator.Position> next = store.getState()
                .flatMap(state -> new SessionNavigator(state).nextIncomplete());
        if (next.isEmpty())
        {
            System.out.println("Nothing left to do");
            return;
        }
        System.out.printf("Next: %s set %s%n", next.get().exercise().id(), next.get().set().id());
    }

    private static String formatMetrics(SetMetrics metrics)
    {
        if (metrics.hasNoValues())
        {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (metrics.reps() != null)
        {
            sb.append(metrics.reps()).append(" reps ");
        }
        if (metrics.weight() != null)
        {
            sb.append(String.format(Locale.ROOT, "%.1f kg ", metrics.weight().toKilograms()));
        }
        if (metrics.distance() != null)
        {
            sb.append(String.format(Locale.ROOT, "%.0f m ", metrics.distance().toMeters()));
        }
        if (metrics.duration() != null)
        {
            sb.append(metrics.duration().seconds()).append(" s");
        }
        return sb.toString().trim();
    }

    public void disconnect()
    {
        statusWatch.dispose();
        client.close();
        registry.close();
        store.close();
    }

    public static void main(String[] args)
    {
        String baseUrl = Optional.ofNullable(System.getenv(BASE_URL_ENV)).orElse(DEFAULT_BASE_URL);
        String token = System.getenv(TOKEN_ENV);

        // Parse arguments
        for (int i = 0; i < args.length; i++)
        {
            switch (args[i])
            {
                case "-u", "--url" ->
                {
                    if (i + 1 < args.length)
                    {
                        baseUrl = args[++i];
                    }
                }
                case "-t", "--token" ->
                {
                    if (i + 1 < args.length)
                    {
                        token = args[++i];
                    }
                }
                case "--help" ->
                {
                    System.out.println("Usage: demo-client [options]");
                    System.out.println("Options:");
                    System.out.println("  -u, --url <url>      Server base URL (default: $" + BASE_URL_ENV
                            + " or " + DEFAULT_BASE_URL + ")");
                    System.out.println("  -t, --token <token>  Bearer token (default: $" + TOKEN_ENV + ")");
                    System.exit(0);
                }
                default -> System.err.println("Ignoring unknown option: " + args[i]);
            }
        }

        String bearer = token;
        CredentialProvider credentials = () -> Optional.ofNullable(bearer).filter(t -> !t.isBlank());
        if (bearer == null)
        {
            System.out.println("No token given; the server will likely reject the session channel.");
        }

        DemoClient demoClient = new DemoClient(baseUrl, credentials);
        demoClient.connect();

        // Run command loop
        demoClient.runCommandLoop();

        // Cleanup
        demoClient.disconnect();
    }
}
