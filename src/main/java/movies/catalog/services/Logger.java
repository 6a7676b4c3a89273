package movies.catalog.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.file.OpenOptions;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedList;
import java.util.List;

/**
 * CSV log sink for the whole server.
 *
 * <p>Every component publishes lines of the form
 * <code>message,level,Class,Operation,Category</code> to the <code>log</code> address.
 * This verticle:</p>
 * <ul>
 *   <li>buffers them and appends to <code>logs/current.csv</code> every <b>20&nbsp;seconds</b>;</li>
 *   <li>rotates the file once a day, renaming it to the block's start stamp;</li>
 *   <li>keeps the latest <b>12</b> rotated files and deletes older ones;</li>
 *   <li>flushes immediately on <code>catalog.logger.flush</code> (sent at shutdown).</li>
 * </ul>
 */
public class Logger extends AbstractVerticle {

  /* ---------- configuration ---------- */

  public static final String FLUSH_ADDRESS = "catalog.logger.flush";

  private static final long FLUSH_INTERVAL_MS  = 20_000;
  private static final long ROTATE_INTERVAL_MS = 86_400_000L;  // 24 hours
  private static final int  MAX_HISTORIC_FILES = 12;
  private static final String HEADER = "Message,Level,Class,Operation,Category,SequenceReceived,EpochTimeMillis\n";
  private static final DateTimeFormatter FILE_STAMP =
          DateTimeFormatter.ofPattern("yyyyMMdd_HHmm").withZone(ZoneId.of("UTC"));

  /* ---------- state ---------- */

  private final LinkedList<String> buffer = new LinkedList<>();
  private int sequenceCounter = 0;
  private long currentBlockStart;

  /* ---------- paths ---------- */

  private String logsDir;
  private String currentFile;

  @Override
  public void start(Promise<Void> startPromise) {
    logsDir     = config().getString("logsDir", "./data/catalog/logs");
    currentFile = logsDir + "/current.csv";

    vertx.fileSystem().mkdirs(logsDir)
      .compose(v -> vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER)))
      .onSuccess(v -> {
        currentBlockStart = System.currentTimeMillis();
        setupConsumers();
        scheduleFlush();
        startPromise.complete();
      })
      .onFailure(err -> {
        System.err.println("Logger could not prepare " + currentFile + ": " + err.getMessage());
        startPromise.fail(err);
      });
  }

  /* ---------- initialisation ---------- */

  private void setupConsumers() {
    vertx.eventBus().consumer("log", msg -> {
      sequenceCounter++;
      long now = System.currentTimeMillis();
      buffer.add(msg.body() + "," + sequenceCounter + "," + now + "\n");
    });

    vertx.eventBus().consumer(FLUSH_ADDRESS, m -> flushBuffer(ar -> {
      if (ar.succeeded()) {
        m.reply("flushed");
      } else {
        m.fail(500, ar.cause().getMessage());
      }
    }));
  }

  /* ---------- periodic tasks ---------- */

  private void scheduleFlush() {
    vertx.setPeriodic(FLUSH_INTERVAL_MS, id -> {
      long now = System.currentTimeMillis();
      if (now - currentBlockStart >= ROTATE_INTERVAL_MS) {
        rotate(now, r -> flushBuffer(null));
      } else {
        flushBuffer(null);
      }
    });
  }

  /* ---------- flush / rotate ---------- */

  private void flushBuffer(Handler<AsyncResult<Void>> handler) {
    if (buffer.isEmpty()) {
      if (handler != null) handler.handle(Future.succeededFuture());
      return;
    }

    StringBuilder sb = new StringBuilder();
    buffer.forEach(sb::append);
    buffer.clear();

    vertx.fileSystem().open(currentFile, new OpenOptions().setAppend(true)).onComplete(openRes -> {
      if (openRes.succeeded()) {
        AsyncFile file = openRes.result();
        file.write(Buffer.buffer(sb.toString())).onComplete(wr -> {
          file.close();
          if (handler != null) handler.handle(wr.mapEmpty());
        });
      } else {
        System.err.println("Logger could not open " + currentFile + ": " + openRes.cause().getMessage());
        if (handler != null) handler.handle(openRes.mapEmpty());
      }
    });
  }

  private void rotate(long now, Handler<AsyncResult<Void>> after) {
    String rotatedPath = logsDir + "/" + FILE_STAMP.format(Instant.ofEpochMilli(currentBlockStart)) + ".csv";

    // Flush first so nothing pending lands in the fresh file
    flushBuffer(flush -> {
      if (flush.failed()) {
        if (after != null) after.handle(flush);
        return;
      }
      vertx.fileSystem().move(currentFile, rotatedPath)
        .compose(v -> {
          currentBlockStart = now;
          return vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER));
        })
        .onComplete(hdr -> {
          if (hdr.succeeded()) {
            cleanupOld();
          }
          if (after != null) after.handle(hdr.mapEmpty());
        });
    });
  }

  private void cleanupOld() {
    vertx.fileSystem().readDir(logsDir, ".*\\.csv").onSuccess(files -> {
      List<String> history = files.stream()
              .filter(p -> !p.endsWith("current.csv"))
              .sorted()
              .toList();

      int excess = history.size() - MAX_HISTORIC_FILES;
      if (excess > 0) {
        history.subList(0, excess).forEach(p -> vertx.fileSystem().delete(p));
      }
    });
  }
}
