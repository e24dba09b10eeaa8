package com.project.image.hairremoval.service;

import com.project.image.hairremoval.exceptions.HairRemovalException;
import com.project.image.hairremoval.exceptions.InvalidImageException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import javax.imageio.ImageIO;

/** Moves rasters between AWT images, RGB-ordered OpenCV mats and encoded bytes. */
public final class ImageConversions {

    private ImageConversions() {}

    public static Mat toRgbMat(BufferedImage image) {
        if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new InvalidImageException("Image is missing or empty");
        }
        BufferedImage bgrImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = bgrImage.createGraphics();
        graphics.drawImage(image, 0, 0, null);
        graphics.dispose();

        byte[] pixels = ((DataBufferByte) bgrImage.getRaster().getDataBuffer()).getData();
        Mat bgr = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        bgr.put(0, 0, pixels);
        Mat rgb = new Mat();
        Imgproc.cvtColor(bgr, rgb, Imgproc.COLOR_BGR2RGB);
        return rgb;
    }

    /** Accepts RGB (CV_8UC3) or grayscale (CV_8UC1) mats. */
    public static BufferedImage toBufferedImage(Mat mat) {
        if (mat.type() == CvType.CV_8UC1) {
            BufferedImage gray = new BufferedImage(mat.cols(), mat.rows(), BufferedImage.TYPE_BYTE_GRAY);
            mat.get(0, 0, ((DataBufferByte) gray.getRaster().getDataBuffer()).getData());
            return gray;
        }
        if (mat.type() != CvType.CV_8UC3) {
            throw new InvalidImageException("Cannot convert " + CvType.typeToString(mat.type()) + " to an image");
        }
        Mat bgr = new Mat();
        Imgproc.cvtColor(mat, bgr, Imgproc.COLOR_RGB2BGR);
        BufferedImage image = new BufferedImage(mat.cols(), mat.rows(), BufferedImage.TYPE_3BYTE_BGR);
        bgr.get(0, 0, ((DataBufferByte) image.getRaster().getDataBuffer()).getData());
        return image;
    }

    public static byte[] toPng(Mat mat) {
        return encode(mat, "png");
    }

    public static byte[] toJpeg(Mat mat) {
        return encode(mat, "jpg");
    }

    public static String toDataUri(byte[] bytes, String mimeType) {
        return "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(bytes);
    }

    private static byte[] encode(Mat mat, String format) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(toBufferedImage(mat), format, baos)) {
                throw new HairRemovalException("No image writer for format " + format);
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new HairRemovalException("Failed to encode image", e);
        }
    }
}
