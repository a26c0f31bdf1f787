package com.example.invoiceflow.support;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Builds in-memory PDFs and QR images for tests.
 */
public final class TestDocuments {

    private static final int QR_SIZE = 240;

    private TestDocuments() {
    }

    /**
     * Creates a PDF with one page per entry; each entry's lines are written top to bottom.
     *
     * @param pages text lines per page
     * @return PDF bytes
     * @throws IOException when PDFBox cannot create or save the document
     */
    public static byte[] pdf(List<List<String>> pages) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            for (List<String> lines : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    contentStream.beginText();
                    contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 14);
                    contentStream.setLeading(20);
                    contentStream.newLineAtOffset(72, 700);
                    for (String line : lines) {
                        contentStream.showText(line);
                        contentStream.newLine();
                    }
                    contentStream.endText();
                }
            }
            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }

    public static byte[] singlePagePdf(String... lines) throws IOException {
        return pdf(List.of(List.of(lines)));
    }

    /**
     * @param payloads one QR code per payload, laid out left to right with a white gap
     * @return PNG bytes
     */
    public static byte[] qrImage(String... payloads) throws IOException {
        int gap = 80;
        int width = payloads.length == 0 ? QR_SIZE : payloads.length * QR_SIZE + (payloads.length + 1) * gap;
        int height = QR_SIZE + 2 * gap;
        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = canvas.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, width, height);
            int x = gap;
            for (String payload : payloads) {
                graphics.drawImage(qrCode(payload), x, gap, null);
                x += QR_SIZE + gap;
            }
        } finally {
            graphics.dispose();
        }
        return png(canvas);
    }

    /**
     * @return PNG bytes of a plain white image with no code in it
     */
    public static byte[] blankImage() throws IOException {
        return qrImage();
    }

    private static BufferedImage qrCode(String payload) {
        try {
            BitMatrix matrix = new QRCodeWriter().encode(payload, BarcodeFormat.QR_CODE, QR_SIZE, QR_SIZE,
                    Map.of(EncodeHintType.CHARACTER_SET, "UTF-8"));
            return MatrixToImageWriter.toBufferedImage(matrix);
        } catch (WriterException ex) {
            throw new IllegalStateException("Unable to encode QR payload " + payload, ex);
        }
    }

    private static byte[] png(BufferedImage image) throws IOException {
        try (ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", outputStream);
            return outputStream.toByteArray();
        }
    }
}
