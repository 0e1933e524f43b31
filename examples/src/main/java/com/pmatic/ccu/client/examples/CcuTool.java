package com.pmatic.ccu.client.examples;

import com.pmatic.ccu.client.DefaultClientBuilder;
import com.pmatic.ccu.client.api.CcuClient;
import com.pmatic.ccu.client.api.ClientConfiguration;
import com.pmatic.ccu.client.api.ClientConfigurationBuilder;
import com.pmatic.ccu.client.api.exception.ClientException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line access to the XML-RPC API of a CCU.
 * <pre>
 * ccu-tool --address 192.168.1.26 --list
 * ccu-tool --address 192.168.1.26 --call interface_get_value KEQ0123456:1 LEVEL
 * </pre>
 */
public class CcuTool {
    private static final Logger log = LoggerFactory.getLogger(CcuTool.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CLIENT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options options = buildOptions();
        ToolOptions toolOptions;
        try {
            toolOptions = parseOptions(options, args);
        } catch (ParseException e) {
            err.println(e.getMessage());
            printHelp(options, err);
            return EXIT_USAGE;
        }
        if (toolOptions.isHelp()) {
            printHelp(options, out);
            return EXIT_OK;
        }
        if (!toolOptions.isList() && toolOptions.getMethodName() == null) {
            err.println("Nothing to do, use --list or --call");
            printHelp(options, err);
            return EXIT_USAGE;
        }

        try {
            CcuClient client = new DefaultClientBuilder()
                .setClientConfiguration(toolOptions.toClientConfiguration())
                .build();
            if (toolOptions.isList()) {
                client.printMethods(out);
            }
            if (toolOptions.getMethodName() != null) {
                Object[] arguments = toolOptions.getArguments().stream().map(CcuTool::parseArgument).toArray();
                log.debug("Calling {} with {}", toolOptions.getMethodName(), Arrays.toString(arguments));
                out.println(format(client.invoke(toolOptions.getMethodName(), arguments)));
            }
            return EXIT_OK;
        } catch (ClientException e) {
            err.println(e.getKind() + ": " + e.getMessage());
            return EXIT_CLIENT_ERROR;
        }
    }

    /**
     * Converts a command line argument to the XML-RPC type it looks like: int, double, boolean or string.
     */
    static Object parseArgument(String argument) {
        if ("true".equalsIgnoreCase(argument) || "false".equalsIgnoreCase(argument)) {
            return Boolean.parseBoolean(argument);
        }
        try {
            return Integer.parseInt(argument);
        } catch (NumberFormatException ignored) {
            // not an int
        }
        try {
            return Double.parseDouble(argument);
        } catch (NumberFormatException ignored) {
            // not a double
        }
        return argument;
    }

    static String format(Object result) {
        if (result instanceof Object[]) {
            return Arrays.deepToString((Object[]) result);
        }
        return String.valueOf(result);
    }

    @Builder
    @Getter
    static class ToolOptions {
        public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;

        private boolean help;
        private String address;
        private int connectTimeoutSeconds;
        private String username;
        private String password;
        private boolean list;
        private String methodName;
        private List<String> arguments;

        ClientConfiguration toClientConfiguration() throws ClientException {
            ClientConfigurationBuilder builder = ClientConfiguration.newBuilder()
                .setAddress(address)
                .setConnectionTimeout(Duration.ofSeconds(connectTimeoutSeconds));
            if (username != null) {
                builder.setBasicUserName(username);
            }
            if (password != null) {
                builder.setBasicPassword(password);
            }
            return builder.build();
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption("h", "help", false, "print this message");
        options.addOption(Option.builder("a")
            .longOpt("address")
            .type(String.class)
            .hasArg()
            .desc("address of the CCU, e.g. 192.168.1.26 or https://ccu.local")
            .build());
        options.addOption(Option.builder()
            .longOpt("connect-timeout")
            .type(Integer.class)
            .hasArg()
            .desc("connect timeout in seconds, default " + ToolOptions.DEFAULT_CONNECT_TIMEOUT_SECONDS)
            .build());
        options.addOption(Option.builder("u")
            .longOpt("username")
            .hasArg()
            .desc("user name for HTTP basic authentication")
            .build());
        options.addOption(Option.builder("p")
            .longOpt("password")
            .hasArg()
            .desc("password for HTTP basic authentication")
            .build());
        options.addOption(Option.builder("l")
            .longOpt("list")
            .desc("print the methods offered by the CCU")
            .build());
        options.addOption(Option.builder("c")
            .longOpt("call")
            .hasArg()
            .argName("method")
            .desc("call a method by its local name, remaining arguments are passed to it")
            .build());
        return options;
    }

    static ToolOptions parseOptions(Options options, String[] args) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(options, args);
        if (cmd.hasOption("help")) {
            return ToolOptions.builder().help(true).build();
        }
        if (!cmd.hasOption("address")) {
            throw new ParseException("Missing required option: address");
        }
        int connectTimeout;
        try {
            connectTimeout = Integer.parseInt(cmd.getOptionValue("connect-timeout",
                String.valueOf(ToolOptions.DEFAULT_CONNECT_TIMEOUT_SECONDS)));
        } catch (NumberFormatException e) {
            throw new ParseException("connect-timeout is not a number: " + cmd.getOptionValue("connect-timeout"));
        }
        if (connectTimeout < 0) {
            throw new ParseException("connect-timeout must not be negative: " + connectTimeout);
        }
        return ToolOptions.builder()
            .address(cmd.getOptionValue("address"))
            .connectTimeoutSeconds(connectTimeout)
            .username(cmd.getOptionValue("username"))
            .password(cmd.getOptionValue("password"))
            .list(cmd.hasOption("list"))
            .methodName(cmd.getOptionValue("call"))
            .arguments(cmd.getArgList())
            .build();
    }

    private static void printHelp(Options options, PrintStream stream) {
        HelpFormatter formatter = new HelpFormatter();
        PrintWriter writer = new PrintWriter(stream);
        formatter.printHelp(writer, formatter.getWidth(), "ccu-tool", null, options,
            formatter.getLeftPadding(), formatter.getDescPadding(), null, true);
        writer.flush();
    }
}
