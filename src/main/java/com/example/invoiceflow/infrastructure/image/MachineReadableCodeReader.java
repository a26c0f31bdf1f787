package com.example.invoiceflow.infrastructure.image;

import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.LuminanceSource;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.multi.GenericMultipleBarcodeReader;
import com.google.zxing.multi.MultipleBarcodeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Infrastructure service that scans raster images for embedded QR codes and barcodes using ZXing.
 */
@Service
public class MachineReadableCodeReader {

    private static final Logger log = LoggerFactory.getLogger(MachineReadableCodeReader.class);
    private static final Map<DecodeHintType, Object> HINTS = buildHints();

    /**
     * Decodes every code ZXing can find in the image.
     *
     * @param imageFile local image file
     * @return payloads in decode order; empty when the image carries no readable code
     * @throws IOException when the file is not an image format ImageIO can read
     */
    public List<String> decodeAll(Path imageFile) throws IOException {
        BufferedImage image = ImageIO.read(imageFile.toFile());
        if (image == null) {
            throw new IOException("Unsupported or corrupt image: " + imageFile.getFileName());
        }
        LuminanceSource source = new BufferedImageLuminanceSource(image);
        BinaryBitmap bitmap = new BinaryBitmap(new HybridBinarizer(source));
        MultipleBarcodeReader reader = new GenericMultipleBarcodeReader(new MultiFormatReader());

        Result[] results;
        try {
            results = reader.decodeMultiple(bitmap, HINTS);
        } catch (NotFoundException ex) {
            log.debug("No machine-readable code found in {}x{} image", image.getWidth(), image.getHeight());
            return List.of();
        }

        List<String> payloads = new ArrayList<>(results.length);
        for (Result result : results) {
            if (result.getText() != null) {
                payloads.add(result.getText());
            }
        }
        return payloads;
    }

    private static Map<DecodeHintType, Object> buildHints() {
        Map<DecodeHintType, Object> hints = new EnumMap<>(DecodeHintType.class);
        hints.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
        hints.put(DecodeHintType.CHARACTER_SET, "UTF-8");
        return hints;
    }
}
