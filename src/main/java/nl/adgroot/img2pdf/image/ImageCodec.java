package nl.adgroot.img2pdf.image;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;

public class ImageCodec {

  public static final float DEFAULT_JPEG_QUALITY = 0.75f;

  /** Images above this pixel count are refused before their pixels are allocated. */
  public static final long DEFAULT_MAX_PIXELS = 178_956_970L;

  private final float jpegQuality;
  private final long maxPixels;

  public ImageCodec() {
    this(DEFAULT_JPEG_QUALITY);
  }

  public ImageCodec(float jpegQuality) {
    this(jpegQuality, DEFAULT_MAX_PIXELS);
  }

  public ImageCodec(float jpegQuality, long maxPixels) {
    if (jpegQuality <= 0f || jpegQuality > 1f) {
      throw new IllegalArgumentException("JPEG quality must be in (0, 1]: " + jpegQuality);
    }
    if (maxPixels <= 0) {
      throw new IllegalArgumentException("Pixel limit must be positive: " + maxPixels);
    }
    this.jpegQuality = jpegQuality;
    this.maxPixels = maxPixels;
  }

  /**
   * Decodes PNG/JPEG/GIF/BMP bytes, flattens the pixels to opaque RGB and re-encodes them
   * as JPEG for embedding.
   *
   * @throws DecodeException when the bytes are not a readable image, have a zero dimension or
   *     declare more pixels than the configured limit
   */
  public DecodedImage decode(byte[] bytes) throws DecodeException {
    if (bytes == null || bytes.length == 0) {
      throw new DecodeException("Empty image data");
    }

    BufferedImage source;
    try {
      source = read(bytes);
    } catch (DecodeException e) {
      throw e;
    } catch (IOException e) {
      throw new DecodeException("Cannot read image: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      // some ImageIO plugins fail with unchecked exceptions on truncated data
      throw new DecodeException("Corrupt image data: " + e, e);
    }

    int w = source.getWidth();
    int h = source.getHeight();
    BufferedImage rgb = toRgb(source);
    try {
      return new DecodedImage(w, h, encodeJpeg(rgb));
    } catch (IOException e) {
      throw new DecodeException("Cannot encode image as JPEG: " + e.getMessage(), e);
    }
  }

  public float getJpegQuality() {
    return jpegQuality;
  }

  public long getMaxPixels() {
    return maxPixels;
  }

  /** First frame only; the header size is checked before the pixels are decoded. */
  private BufferedImage read(byte[] bytes) throws IOException {
    try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
      Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
      if (!readers.hasNext()) {
        throw new DecodeException("Unsupported image format");
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(in, true, true);
        int w = reader.getWidth(0);
        int h = reader.getHeight(0);
        if (w <= 0 || h <= 0) {
          throw new DecodeException("Image has no pixels: " + w + "x" + h);
        }
        if ((long) w * h > maxPixels) {
          throw new DecodeException("Image too large: " + w + "x" + h + " exceeds " + maxPixels + " pixels");
        }
        return reader.read(0);
      } finally {
        reader.dispose();
      }
    }
  }

  static BufferedImage toRgb(BufferedImage source) {
    if (source.getType() == BufferedImage.TYPE_INT_RGB) {
      return source;
    }

    int w = source.getWidth();
    int h = source.getHeight();
    BufferedImage rgb = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);

    int type = source.getType();
    if (type == BufferedImage.TYPE_BYTE_GRAY || type == BufferedImage.TYPE_USHORT_GRAY) {
      // stored gray levels map 1:1 to RGB; getRGB would treat them as linear and brighten them
      int shift = type == BufferedImage.TYPE_USHORT_GRAY ? 8 : 0;
      Raster raster = source.getRaster();
      int[] samples = new int[w];
      int[] row = new int[w];
      for (int y = 0; y < h; y++) {
        raster.getSamples(0, y, w, 1, 0, samples);
        for (int x = 0; x < w; x++) {
          int v = samples[x] >> shift;
          row[x] = (v << 16) | (v << 8) | v;
        }
        rgb.setRGB(0, y, w, 1, row, 0, w);
      }
      return rgb;
    }

    // row by row to keep the ARGB buffer small on large scans; alpha is dropped by setRGB
    int[] row = new int[w];
    for (int y = 0; y < h; y++) {
      source.getRGB(0, y, w, 1, row, 0, w);
      rgb.setRGB(0, y, w, 1, row, 0, w);
    }
    return rgb;
  }

  private byte[] encodeJpeg(BufferedImage rgb) throws IOException {
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
    if (!writers.hasNext()) {
      throw new IOException("No JPEG writer available");
    }
    ImageWriter writer = writers.next();

    ImageWriteParam param = writer.getDefaultWriteParam();
    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
    param.setCompressionQuality(jpegQuality);

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
      writer.setOutput(ios);
      writer.write(null, new IIOImage(rgb, null, null), param);
    } finally {
      writer.dispose();
    }
    return out.toByteArray();
  }
}
