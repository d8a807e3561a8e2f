package com.questrail.spatial.protocol.ewkb;

import com.questrail.spatial.protocol.ewkb.codec.EwkbCodecException;
import com.questrail.spatial.protocol.ewkb.codec.EwkbGeometryDecoder;
import com.questrail.spatial.protocol.ewkb.codec.EwkbGeometryEncoder;
import com.questrail.spatial.protocol.ewkb.codec.MisconfiguredFallbackException;
import com.questrail.spatial.protocol.ewkb.codec.RawBytesCodec;
import com.questrail.spatial.protocol.ewkb.codec.impl.DefaultEwkbGeometryDecoder;
import com.questrail.spatial.protocol.ewkb.codec.impl.DefaultEwkbGeometryEncoder;
import com.questrail.spatial.protocol.ewkb.config.EwkbCodecConfig;
import com.questrail.spatial.protocol.ewkb.model.Geometry;
import com.questrail.spatial.protocol.ewkb.observability.EwkbErrorEvent;
import com.questrail.spatial.protocol.ewkb.observability.EwkbObservabilitySink;
import com.questrail.spatial.protocol.ewkb.observability.GeometryDecodedEvent;
import com.questrail.spatial.protocol.ewkb.observability.GeometryEncodedEvent;
import com.questrail.spatial.protocol.ewkb.transport.EwkbReadBuffer;
import com.questrail.spatial.protocol.ewkb.transport.EwkbWriteBuffer;
import com.questrail.spatial.protocol.ewkb.transport.netty.ByteBufEwkbReadBuffer;
import com.questrail.spatial.protocol.ewkb.transport.netty.ByteBufEwkbWriteBuffer;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * EwkbGeometryTypeHandler
 * =============================================================================
 * Entry point a value-transfer layer invokes for PostGIS {@code geometry}
 * fields.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>wiring component</strong>. It composes the decoder,
 * the encoder, the optional raw-bytes fallback and the observability sink
 * into the operations a database client calls per field value:
 *
 * <ul>
 *   <li>{@link #read(EwkbReadBuffer, int)} / {@link #readRaw(EwkbReadBuffer, int)}</li>
 *   <li>{@link #validateAndGetLength(Geometry)} before any byte is written</li>
 *   <li>{@link #write(Geometry, EwkbWriteBuffer)} / {@link #writeRaw(byte[], EwkbWriteBuffer)}</li>
 * </ul>
 *
 * <p><strong>No wire knowledge lives here.</strong> Choosing which column type
 * maps to this handler is the caller's business.</p>
 *
 * <h2>Failure reporting</h2>
 * Decode and encode failures are reported to the observability sink and then
 * rethrown unchanged. Nothing is retried and no partial value is returned.
 *
 * <h2>Thread Safety</h2>
 * The handler is immutable and may be shared. Buffers passed to it are not
 * and must be confined to one call at a time.
 */
public final class EwkbGeometryTypeHandler
{
    private final EwkbGeometryDecoder decoder;
    private final EwkbGeometryEncoder encoder;
    private final EwkbCodecConfig config;
    private final EwkbObservabilitySink sink;

    public EwkbGeometryTypeHandler()
    {
        this(EwkbCodecConfig.defaults());
    }

    public EwkbGeometryTypeHandler(EwkbCodecConfig config)
    {
        this(new DefaultEwkbGeometryDecoder(), new DefaultEwkbGeometryEncoder(), config);
    }

    public EwkbGeometryTypeHandler(EwkbGeometryDecoder decoder,
                                   EwkbGeometryEncoder encoder,
                                   EwkbCodecConfig config)
    {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.config = Objects.requireNonNull(config, "config");
        this.sink = config.observabilitySink();
    }

    // ------------------------------------------------------------------------
    // Read
    // ------------------------------------------------------------------------

    /**
     * Decodes one geometry field value.
     *
     * <p>The port exposes no read position, so this does not check that the
     * value used up all {@code length} bytes; a transport that knows its
     * field boundary checks that itself, as {@link #fromBytes(byte[])},
     * {@link #readFrom(InputStream, int)} and the Netty field codec do.</p>
     *
     * @param length the field length announced by the transport
     */
    public Geometry read(EwkbReadBuffer buffer, int length) throws IOException
    {
        final Geometry geometry;
        try {
            geometry = decoder.decode(buffer);
        }
        catch (EwkbCodecException | IOException e) {
            reportError("Failed to decode geometry value", e);
            throw e;
        }

        reportDecoded(geometry, length);
        return geometry;
    }

    /**
     * Returns the field value's bytes without decoding them.
     *
     * @throws MisconfiguredFallbackException if no raw codec is configured
     */
    public byte[] readRaw(EwkbReadBuffer buffer, int length) throws IOException
    {
        return rawBytesCodec().read(buffer, length);
    }

    // ------------------------------------------------------------------------
    // Length
    // ------------------------------------------------------------------------

    /**
     * Returns the exact EWKB length of {@code geometry}, header included.
     */
    public int validateAndGetLength(Geometry geometry)
    {
        return encoder.encodedLength(geometry);
    }

    /**
     * Returns the length of a raw value.
     *
     * @throws MisconfiguredFallbackException if no raw codec is configured
     */
    public int validateAndGetLength(byte[] value)
    {
        return rawBytesCodec().encodedLength(value);
    }

    // ------------------------------------------------------------------------
    // Write
    // ------------------------------------------------------------------------

    /**
     * Encodes {@code geometry} into {@code buffer}.
     */
    public void write(Geometry geometry, EwkbWriteBuffer buffer) throws IOException
    {
        final int length;
        try {
            length = encoder.encodedLength(geometry);
            encoder.encode(geometry, buffer);
        }
        catch (EwkbCodecException | IOException e) {
            reportError("Failed to encode " + geometry.kind() + " value", e);
            throw e;
        }

        sink.onGeometryEncoded(new GeometryEncodedEvent(
                config.wallClock().now(),
                geometry.kind(),
                geometry.dimensionality(),
                geometry.srid(),
                length));
    }

    /**
     * Writes a raw value verbatim.
     *
     * @throws MisconfiguredFallbackException if no raw codec is configured
     */
    public void writeRaw(byte[] value, EwkbWriteBuffer buffer) throws IOException
    {
        rawBytesCodec().write(value, buffer);
    }

    // ------------------------------------------------------------------------
    // Convenience
    // ------------------------------------------------------------------------

    /**
     * Encodes {@code geometry} into a new array of exactly
     * {@link #validateAndGetLength(Geometry)} bytes.
     */
    public byte[] toBytes(Geometry geometry)
    {
        final ByteBuf buf = Unpooled.buffer(validateAndGetLength(geometry));
        try {
            write(geometry, ByteBufEwkbWriteBuffer.wrap(buf));
            return ByteBufUtil.getBytes(buf);
        }
        catch (IOException e) {
            // A wrapped heap buffer never flushes, so this is not expected.
            throw new UncheckedIOException("In-memory EWKB encode failed", e);
        }
        finally {
            buf.release();
        }
    }

    /**
     * Decodes a complete EWKB value held in memory.
     *
     * @throws java.io.EOFException if {@code ewkb} is truncated
     * @throws EwkbCodecException if bytes remain after the value
     */
    public Geometry fromBytes(byte[] ewkb) throws IOException
    {
        Objects.requireNonNull(ewkb, "ewkb");
        return readField(ByteBufEwkbReadBuffer.wrap(Unpooled.wrappedBuffer(ewkb)), ewkb.length);
    }

    /**
     * Decodes one value of exactly {@code length} bytes from a stream through
     * a buffer of {@link EwkbCodecConfig#bufferSize()} bytes. No byte past the
     * field is taken from {@code in}.
     *
     * @throws java.io.EOFException if the stream ends inside the field
     * @throws EwkbCodecException if the value is shorter than {@code length}
     */
    public Geometry readFrom(InputStream in, int length) throws IOException
    {
        return readField(ByteBufEwkbReadBuffer.over(in, config.bufferSize(), length), length);
    }

    /**
     * Encodes one value to a stream through a buffer of
     * {@link EwkbCodecConfig#bufferSize()} bytes, flushing at the end.
     */
    public void writeTo(Geometry geometry, OutputStream out) throws IOException
    {
        ByteBufEwkbWriteBuffer buffer = ByteBufEwkbWriteBuffer.over(out, config.bufferSize());
        write(geometry, buffer);
        buffer.flush();
    }

    private Geometry readField(ByteBufEwkbReadBuffer buffer, int length) throws IOException
    {
        final Geometry geometry;
        try {
            geometry = decoder.decode(buffer);
            final long unread = buffer.unreadBytes();
            if (unread > 0) {
                throw new EwkbCodecException(
                        unread + " unread bytes after " + geometry.kind() + " value in field of " + length);
            }
        }
        catch (EwkbCodecException | IOException e) {
            reportError("Failed to decode geometry value", e);
            throw e;
        }

        reportDecoded(geometry, length);
        return geometry;
    }

    private void reportDecoded(Geometry geometry, int length)
    {
        sink.onGeometryDecoded(new GeometryDecodedEvent(
                config.wallClock().now(),
                geometry.kind(),
                geometry.dimensionality(),
                geometry.srid(),
                length));
    }

    private RawBytesCodec rawBytesCodec()
    {
        return config.rawBytesCodec().orElseThrow(() -> new MisconfiguredFallbackException(
                "Raw geometry bytes requested but no RawBytesCodec is configured"));
    }

    private void reportError(String message, Throwable cause)
    {
        sink.onError(new EwkbErrorEvent(config.wallClock().now(), message, cause));
    }
}
