package org.taskfarm.farm.resources.transport.socket;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

import org.taskfarm.farm.api.messages.Abort;
import org.taskfarm.farm.api.messages.Termination;
import org.taskfarm.farm.api.messages.WorkUnit;
import org.taskfarm.farm.api.messages.WorkerMessage;

/**
 * Wire format of the socket transport. Every frame is one tag byte followed by its fields,
 * written with {@link DataOutputStream}:
 * <pre>
 *   HELLO           int protocolVersion                    worker -> dispatcher
 *   WELCOME         int workerId, int workerCount          dispatcher -> worker
 *   ASSIGN          double parameter, int count            dispatcher -> worker (count 0 = termination)
 *   ABORT           UTF reason                             dispatcher -> worker
 *   RESULT          int n, n * double                      worker -> dispatcher
 *   FAILED          UTF reason                             worker -> dispatcher
 *   BARRIER_ARRIVE  (no fields)                            worker -> dispatcher
 *   BARRIER_RELEASE (no fields)                            dispatcher -> worker
 * </pre>
 * Callers flush after each frame.
 */
final class Frames {

    static final int PROTOCOL_VERSION = 1;

    static final byte HELLO = 1;
    static final byte WELCOME = 2;
    static final byte ASSIGN = 3;
    static final byte ABORT = 4;
    static final byte RESULT = 5;
    static final byte FAILED = 6;
    static final byte BARRIER_ARRIVE = 7;
    static final byte BARRIER_RELEASE = 8;

    private Frames() {
    }

    static void writeWorkerMessage(DataOutputStream out, WorkerMessage message) throws IOException {
        if (message instanceof WorkUnit unit) {
            out.writeByte(ASSIGN);
            out.writeDouble(unit.parameter());
            out.writeInt(unit.requestedCount());
        } else if (message instanceof Termination) {
            out.writeByte(ASSIGN);
            out.writeDouble(0.0);
            out.writeInt(0);
        } else if (message instanceof Abort abort) {
            out.writeByte(ABORT);
            out.writeUTF(abort.reason());
        } else {
            throw new IllegalArgumentException("Unsupported message " + message);
        }
        out.flush();
    }

    /**
     * Decodes the body of an {@code ASSIGN} or {@code ABORT} frame whose tag has already been read.
     */
    static WorkerMessage readWorkerMessage(byte tag, DataInputStream in) throws IOException {
        switch (tag) {
            case ASSIGN -> {
                double parameter = in.readDouble();
                int count = in.readInt();
                if (count < 0) {
                    throw new IOException("Negative count in ASSIGN frame: " + count);
                }
                return count == 0 ? Termination.INSTANCE : new WorkUnit(parameter, count);
            }
            case ABORT -> {
                return new Abort(in.readUTF());
            }
            default -> throw new IOException("Unexpected frame tag " + tag + " for a worker message");
        }
    }

    static void writeValues(DataOutputStream out, double[] values) throws IOException {
        out.writeByte(RESULT);
        out.writeInt(values.length);
        for (double value : values) {
            out.writeDouble(value);
        }
        out.flush();
    }

    /**
     * Decodes the body of a {@code RESULT} frame whose tag has already been read.
     *
     * @param maxValues upper bound accepted for the value count.
     */
    static double[] readValues(DataInputStream in, int maxValues) throws IOException {
        int n = in.readInt();
        if (n < 0 || n > maxValues) {
            throw new IOException("Invalid value count in RESULT frame: " + n);
        }
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = in.readDouble();
        }
        return values;
    }

    static void writeSignal(DataOutputStream out, byte tag) throws IOException {
        out.writeByte(tag);
        out.flush();
    }

    static void writeReason(DataOutputStream out, byte tag, String reason) throws IOException {
        out.writeByte(tag);
        out.writeUTF(reason.length() > 1000 ? reason.substring(0, 1000) : reason);
        out.flush();
    }
}
