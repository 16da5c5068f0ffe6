package com.watchpost.pipeline.sink;

import com.watchpost.pipeline.acquisition.Frame;
import com.watchpost.pipeline.inference.BoundingBox;
import com.watchpost.pipeline.inference.Detection;
import com.watchpost.pipeline.inference.DetectionSet;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Saves the event frame with its bounding boxes (outlines only) as {@code <root>/<yyyy-MM-dd>/<eventId>.jpg}. */
public class AnnotatedImageWriter {
    final static Logger LOGGER = LoggerFactory.getLogger(AnnotatedImageWriter.class);
    static final Color BOX_COLOR = Color.GREEN;

    final File eventDataFolder;
    final ZoneId partitionZone;

    public AnnotatedImageWriter(File eventDataFolder, ZoneId partitionZone) {
        this.eventDataFolder = eventDataFolder;
        this.partitionZone = partitionZone;
    }

    /** @return image path relative to the event data root */
    public String write(String eventId, Instant timestamp, Frame frame, DetectionSet detections) throws IOException {
        String partition = timestamp.atZone(partitionZone).toLocalDate().format(DatedJsonEventSink.DATE_FORMATTER);
        File partitionFolder = new File(eventDataFolder, partition);
        if (!partitionFolder.exists()) {
            partitionFolder.mkdirs();
        }
        String fileName = eventId + ".jpg";

        BufferedImage image = toImage(frame);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(BOX_COLOR);
            graphics.setStroke(new BasicStroke(2.0f));
            for (Detection detection : detections.detections()) {
                BoundingBox box = detection.boundingBox();
                graphics.drawRect(box.x(), box.y(), box.width(), box.height());
            }
        } finally {
            graphics.dispose();
        }

        File imageFile = new File(partitionFolder, fileName);
        if (!ImageIO.write(image, "jpg", imageFile)) {
            throw new IOException("No JPEG writer available for " + imageFile);
        }
        LOGGER.debug("Saved event image {}", imageFile);
        return partition + "/" + fileName;
    }

    static BufferedImage toImage(Frame frame) {
        BufferedImage image = new BufferedImage(frame.width(), frame.height(), BufferedImage.TYPE_INT_RGB);
        int index = 0;
        for (int y = 0; y < frame.height(); y++) {
            for (int x = 0; x < frame.width(); x++) {
                int luminance = frame.luminance(index++);
                image.setRGB(x, y, (luminance << 16) | (luminance << 8) | luminance);
            }
        }
        return image;
    }
}
