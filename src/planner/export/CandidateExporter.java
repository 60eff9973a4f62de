package planner.export;

import com.lowagie.text.Document;
import com.lowagie.text.DocumentException;
import com.lowagie.text.Element;
import com.lowagie.text.Font;
import com.lowagie.text.FontFactory;
import com.lowagie.text.PageSize;
import com.lowagie.text.Paragraph;
import com.lowagie.text.Phrase;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import planner.core.PlanResult;
import planner.model.ScheduleCandidate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a ranked plan result as a flat table: one row per candidate.
 */
public class CandidateExporter {

    public static final String[] HEADER = {
            "Rank", "Conflicts", "Priority", "Credits", "Required", "Elective", "Offerings"
    };

    public static String[] toRow(int rank, ScheduleCandidate c) {
        return new String[]{
                String.valueOf(rank),
                String.valueOf(c.getConflictCount()),
                String.valueOf(c.getTotalPriority()),
                String.valueOf(c.getTotalCredits()),
                String.valueOf(c.getRequiredCredits()),
                String.valueOf(c.getElectiveCredits()),
                CandidateReport.offeringsCell(c)
        };
    }

    /**
     * Two sheets, "Clean" and "Conflicting", each ranked under the result's policy.
     */
    public static void exportExcel(PlanResult result, Path outputPath) throws IOException {
        if (result == null || outputPath == null)
            throw new IllegalArgumentException("result and outputPath are required");

        try (XSSFWorkbook wb = new XSSFWorkbook()) {
            writeSheet(wb.createSheet("Clean"), result.getClean());
            writeSheet(wb.createSheet("Conflicting"), result.getConflicting());

            try (OutputStream out = Files.newOutputStream(outputPath)) {
                wb.write(out);
            }
        }
    }

    private static void writeSheet(Sheet sheet, List<ScheduleCandidate> candidates) {
        int r = 0;
        Row headerRow = sheet.createRow(r++);
        for (int c = 0; c < HEADER.length; c++) {
            headerRow.createCell(c).setCellValue(HEADER[c]);
        }

        int rank = 1;
        for (ScheduleCandidate cand : candidates) {
            Row row = sheet.createRow(r++);
            row.createCell(0).setCellValue(rank++);
            row.createCell(1).setCellValue(cand.getConflictCount());
            row.createCell(2).setCellValue(cand.getTotalPriority());
            row.createCell(3).setCellValue(cand.getTotalCredits());
            row.createCell(4).setCellValue(cand.getRequiredCredits());
            row.createCell(5).setCellValue(cand.getElectiveCredits());
            row.createCell(6).setCellValue(CandidateReport.offeringsCell(cand));
        }

        for (int c = 0; c < HEADER.length; c++) {
            sheet.autoSizeColumn(c);
        }
    }

    /**
     * Title plus one table of all candidates in ranked order. The document is
     * built in memory first so a failure never leaves a half-written file.
     */
    public static void exportPdf(PlanResult result, Path outputPath) throws IOException {
        if (result == null || outputPath == null)
            throw new IllegalArgumentException("result and outputPath are required");

        ByteArrayOutputStream baos = new ByteArrayOutputStream(64 * 1024);
        Document doc = new Document(PageSize.A4.rotate());
        try {
            PdfWriter.getInstance(doc, baos);
            doc.open();

            Font titleFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 14);
            Paragraph title = new Paragraph("Timetable Plans", titleFont);
            title.setAlignment(Element.ALIGN_CENTER);
            doc.add(title);

            Font noteFont = FontFactory.getFont(FontFactory.HELVETICA, 9);
            String note = "Policy: " + result.getPolicy()
                    + " | clean: " + result.getClean().size()
                    + " | conflicting: " + result.getConflicting().size()
                    + (result.isTruncated() ? " | truncated (" + result.getProductSize() + " possible)" : "");
            doc.add(new Paragraph(note, noteFont));
            doc.add(new Paragraph(" "));

            PdfPTable table = new PdfPTable(HEADER.length);
            table.setWidthPercentage(100);
            table.setWidths(new float[]{4f, 6f, 6f, 6f, 6f, 6f, 40f});
            table.setHeaderRows(1);

            Font headerFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 10);
            Font cellFont = FontFactory.getFont(FontFactory.HELVETICA, 9);

            for (String h : HEADER) {
                PdfPCell hc = new PdfPCell(new Phrase(h, headerFont));
                hc.setHorizontalAlignment(Element.ALIGN_CENTER);
                hc.setPadding(4f);
                table.addCell(hc);
            }

            int rank = 1;
            for (ScheduleCandidate c : result.getRanked()) {
                for (String v : toRow(rank, c)) {
                    PdfPCell cc = new PdfPCell(new Phrase(v, cellFont));
                    cc.setPadding(3f);
                    table.addCell(cc);
                }
                rank++;
            }
            if (result.getRanked().isEmpty()) {
                PdfPCell empty = new PdfPCell(new Phrase("No plans", cellFont));
                empty.setColspan(HEADER.length);
                empty.setPadding(3f);
                table.addCell(empty);
            }

            doc.add(table);
        } catch (DocumentException e) {
            throw new IOException("PDF export failed: " + e.getMessage(), e);
        } finally {
            if (doc.isOpen())
                doc.close();
        }

        Files.write(outputPath, baos.toByteArray());
    }
}
