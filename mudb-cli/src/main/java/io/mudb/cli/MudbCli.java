package io.mudb.cli;

import io.mudb.protocol.Errors;
import io.mudb.protocol.Resp;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * 命令行客户端入口
 *
 * <p>用法: mudb-cli [-h 地址] [-p 端口] [命令 参数...]
 * <ul>
 *     <li>带命令时发送一次并打印回复，错误回复的退出码为1</li>
 *     <li>不带命令时进入交互模式，直到输入 quit / exit 或标准输入结束</li>
 * </ul>
 *
 * @author mudb
 * @since 1.0.0
 */
@Slf4j
public class MudbCli {

    static final String DEFAULT_HOST = "127.0.0.1";

    static final int DEFAULT_PORT = 6379;

    static final String USAGE = "用法: mudb-cli [-h 地址] [-p 端口] [命令 参数...]";

    public static void main(final String[] args) {
        final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.exit(run(args, in, System.out, System.err));
    }

    /**
     * 执行一次命令行会话
     *
     * @return 进程退出码
     */
    static int run(final String[] args, final BufferedReader in, final PrintStream out, final PrintStream err) {
        final Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 2;
        }

        try (MudbClient client = new MudbClient(options.getHost(), options.getPort())) {
            client.connect();
            if (!options.getCommand().isEmpty()) {
                final Resp reply = client.send(options.getCommand().toArray(new String[0]));
                out.println(ReplyFormatter.format(reply));
                return reply instanceof Errors ? 1 : 0;
            }
            return repl(client, in, out, err);
        } catch (IOException | TimeoutException e) {
            err.println("无法与 " + options.getHost() + ":" + options.getPort() + " 通信: " + describe(e));
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        }
    }

    private static int repl(final MudbClient client, final BufferedReader in, final PrintStream out,
                            final PrintStream err) throws IOException, TimeoutException, InterruptedException {
        final String prompt = client.getHost() + ":" + client.getPort() + "> ";
        while (true) {
            out.print(prompt);
            out.flush();
            final String line = in.readLine();
            if (line == null) {
                out.println();
                return 0;
            }

            final List<String> words;
            try {
                words = parseLine(line);
            } catch (IllegalArgumentException e) {
                err.println("(error) " + e.getMessage());
                continue;
            }
            if (words.isEmpty()) {
                continue;
            }
            final String first = words.get(0);
            if ("quit".equalsIgnoreCase(first) || "exit".equalsIgnoreCase(first)) {
                return 0;
            }

            log.debug("发送命令: {}", words);
            out.println(ReplyFormatter.format(client.send(words.toArray(new String[0]))));
        }
    }

    /**
     * 把一行输入拆分为参数
     *
     * <p>以空白分隔；双引号内的空白保留，并支持 \" \\ \n \r \t 转义。
     * 引号未闭合，或闭合引号后紧跟非空白字符时抛出异常。
     *
     * @param line 输入行
     * @return 参数列表，空行返回空列表
     * @throws IllegalArgumentException 引号不匹配
     */
    static List<String> parseLine(final String line) {
        final List<String> words = new ArrayList<>();
        final int length = line.length();
        int i = 0;
        while (true) {
            while (i < length && Character.isWhitespace(line.charAt(i))) {
                i++;
            }
            if (i >= length) {
                return words;
            }

            final StringBuilder word = new StringBuilder();
            if (line.charAt(i) == '"') {
                i++;
                boolean closed = false;
                while (i < length) {
                    final char c = line.charAt(i++);
                    if (c == '"') {
                        closed = true;
                        break;
                    }
                    if (c == '\\' && i < length) {
                        word.append(unescape(line.charAt(i++)));
                    } else {
                        word.append(c);
                    }
                }
                if (!closed) {
                    throw new IllegalArgumentException("Invalid argument(s): unbalanced quotes");
                }
                if (i < length && !Character.isWhitespace(line.charAt(i))) {
                    throw new IllegalArgumentException("Invalid argument(s): closing quote must be followed by a space");
                }
            } else {
                while (i < length && !Character.isWhitespace(line.charAt(i))) {
                    word.append(line.charAt(i++));
                }
            }
            words.add(word.toString());
        }
    }

    private static char unescape(final char c) {
        switch (c) {
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 't':
                return '\t';
            default:
                return c;
        }
    }

    private static String describe(final Exception e) {
        if (e instanceof TimeoutException) {
            return "等待回复超时";
        }
        final Throwable cause = e.getCause();
        return cause != null && cause.getMessage() != null ? e.getMessage() + " (" + cause.getMessage() + ")" : e.getMessage();
    }

    /**
     * 命令行参数
     */
    @Getter
    static final class Options {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private List<String> command = Collections.emptyList();

        /**
         * 解析参数，第一个非选项参数及其后的所有参数组成要执行的命令
         *
         * @throws IllegalArgumentException 参数缺少取值或端口非法
         */
        static Options parse(final String[] args) {
            final Options options = new Options();
            int i = 0;
            while (i < args.length) {
                final String arg = args[i];
                if ("-h".equals(arg) || "-p".equals(arg)) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("参数缺少取值: " + arg);
                    }
                    final String value = args[i + 1];
                    if ("-h".equals(arg)) {
                        options.host = value;
                    } else {
                        options.port = parsePort(value);
                    }
                    i += 2;
                } else {
                    break;
                }
            }
            if (i < args.length) {
                final List<String> command = new ArrayList<>(args.length - i);
                for (; i < args.length; i++) {
                    command.add(args[i]);
                }
                options.command = command;
            }
            return options;
        }

        private static int parsePort(final String value) {
            final int port;
            try {
                port = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("-p 需要整数，实际为: " + value, e);
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("端口号必须在1-65535之间: " + port);
            }
            return port;
        }
    }
}
