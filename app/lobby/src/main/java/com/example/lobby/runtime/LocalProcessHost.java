package com.example.lobby.runtime;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalProcessHost implements ProcessHost {

  private static final Logger logger = LoggerFactory.getLogger(LocalProcessHost.class);
  private static final int CONNECT_TIMEOUT_MILLIS = 300;
  private static final long POLL_INTERVAL_MILLIS = 50;

  @Override
  public GameProcess spawn(List<String> command, Path workingDirectory) throws IOException {
    final Process process =
        new ProcessBuilder(command)
            .directory(workingDirectory.toFile())
            .redirectErrorStream(true)
            .redirectOutput(workingDirectory.resolve("server.log").toFile())
            .start();
    logger.info("game server spawned pid={} command={}", process.pid(), command);
    return new LocalGameProcess(process);
  }

  @Override
  public int freePort(String bindHost) throws IOException {
    try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getByName(bindHost))) {
      return socket.getLocalPort();
    }
  }

  @Override
  public boolean awaitReady(GameProcess process, String host, int port, Duration timeout)
      throws InterruptedException {
    final Instant deadline = Instant.now().plus(timeout);
    while (Instant.now().isBefore(deadline)) {
      if (!process.isAlive()) {
        return false;
      }
      try (Socket socket = new Socket()) {
        socket.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT_MILLIS);
        return true;
      } catch (IOException ex) {
        // まだ bind されていない。次のポーリングまで待つ。
        Thread.sleep(POLL_INTERVAL_MILLIS);
      }
    }
    return false;
  }

  private static final class LocalGameProcess implements GameProcess {

    private final Process process;

    private LocalGameProcess(Process process) {
      this.process = process;
    }

    @Override
    public long pid() {
      return process.pid();
    }

    @Override
    public boolean isAlive() {
      return process.isAlive();
    }

    @Override
    public void terminate() {
      if (process.isAlive()) {
        process.destroy();
      }
    }

    @Override
    public CompletableFuture<Integer> onExit() {
      return process.onExit().thenApply(Process::exitValue);
    }
  }
}
