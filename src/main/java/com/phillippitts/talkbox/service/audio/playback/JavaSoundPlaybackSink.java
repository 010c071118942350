package com.phillippitts.talkbox.service.audio.playback;

import com.phillippitts.talkbox.config.properties.PlaybackProperties;
import com.phillippitts.talkbox.exception.PlaybackException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.SourceDataLine;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound based playback that writes PCM16LE mono to a {@link SourceDataLine}.
 *
 * <p>This is the default {@link PlaybackSink}. Applications can replace it by declaring their own
 * sink bean, or disable it with {@code talkbox.playback.enabled=false}.
 *
 * <p>A line is opened per buffer and drained before returning. Not thread-safe; the response
 * pipeline calls it from a single thread.
 */
public class JavaSoundPlaybackSink implements PlaybackSink {

    private static final Logger LOG = LogManager.getLogger(JavaSoundPlaybackSink.class);

    private static final int BITS_PER_SAMPLE = 16;
    private static final int CHANNELS = 1;
    private static final boolean SIGNED = true;
    private static final boolean BIG_ENDIAN = false;

    /** Abstraction to open a SourceDataLine (for testing). */
    public interface LineProvider {
        SourceDataLine open(AudioFormat format, Optional<String> deviceName) throws LineUnavailableException;
    }

    private final PlaybackProperties props;
    private final LineProvider provider;

    public JavaSoundPlaybackSink(PlaybackProperties props) {
        this(props, defaultProvider());
    }

    // Package-private for tests
    JavaSoundPlaybackSink(PlaybackProperties props, LineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.provider = Objects.requireNonNull(provider);
    }

    private static LineProvider defaultProvider() {
        return (format, device) -> {
            SourceDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (SourceDataLine) m.getLine(new DataLine.Info(SourceDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (SourceDataLine) AudioSystem.getLine(new DataLine.Info(SourceDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public void play(float[] samples, int sampleRate) {
        Objects.requireNonNull(samples, "samples");
        if (sampleRate <= 0) {
            throw new PlaybackException("Sample rate must be positive: " + sampleRate);
        }
        if (samples.length == 0) {
            return;
        }

        AudioFormat format = new AudioFormat(sampleRate, BITS_PER_SAMPLE, CHANNELS, SIGNED, BIG_ENDIAN);
        byte[] pcm = toPcm16Le(samples);
        Optional<String> device = Optional.ofNullable(props.getDeviceName()).filter(d -> !d.isBlank());

        SourceDataLine line = null;
        try {
            line = provider.open(format, device);
            line.start();
            int offset = 0;
            while (offset < pcm.length) {
                int n = line.write(pcm, offset, pcm.length - offset);
                if (n <= 0) {
                    throw new PlaybackException("Output line accepted no data at offset " + offset);
                }
                offset += n;
            }
            line.drain();
            LOG.debug("Played {} samples @ {} Hz on device '{}'", samples.length, sampleRate,
                    device.orElse("default"));
        } catch (LineUnavailableException e) {
            throw new PlaybackException("Output device unavailable: " + e.getMessage(), e);
        } catch (SecurityException | IllegalArgumentException e) {
            throw new PlaybackException("Output device rejected playback: " + e.getMessage(), e);
        } finally {
            if (line != null) {
                closeQuietly(line);
            }
        }
    }

    /** Converts floats in [-1, 1] to signed 16-bit little-endian PCM, clipping out-of-range values. */
    static byte[] toPcm16Le(float[] samples) {
        byte[] out = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            float clipped = Math.max(-1f, Math.min(1f, samples[i]));
            int v = Math.round(clipped * Short.MAX_VALUE);
            out[2 * i] = (byte) (v & 0xFF);
            out[2 * i + 1] = (byte) ((v >> 8) & 0xFF);
        }
        return out;
    }

    private static void closeQuietly(SourceDataLine line) {
        try {
            line.stop();
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing output line: {}", e.toString());
        }
    }
}
