package asmsynth.util;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Class for writing files.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** key: file relative path, value: text to write */
  private LinkedHashMap<String, StringBuilder> update_core = new LinkedHashMap<String, StringBuilder>();
  private String base_path = "";

  public FileWriter(String base_path) { this.base_path = base_path; }

  /**
   * Appends text to a file that is written by {@link #WriteFiles()}.
   *
   * @param file The relative path to the file. The path string should be equal for all updates that target the same file.
   * @param text The text to append.
   */
  public void UpdateContent(String file, String text) { update_core.computeIfAbsent(file, file_ -> new StringBuilder()).append(text); }

  public File GetFile(String file) { return new File(base_path, file); }

  /**
   * Writes all files with registered content, replacing existing ones. Missing directories are created.
   */
  public void WriteFiles() throws IOException {
    for (String file : update_core.keySet())
      WriteFile(file, update_core.get(file).toString());
  }

  private void WriteFile(String file, String text) throws IOException {
    File outFile = GetFile(file);
    File parent = outFile.getAbsoluteFile().getParentFile();
    if (parent != null && !parent.isDirectory() && !parent.mkdirs())
      throw new IOException("Cannot create directory " + parent);
    logger.info("Writing " + outFile.getPath());
    try (PrintWriter out = new PrintWriter(new OutputStreamWriter(new FileOutputStream(outFile), StandardCharsets.UTF_8))) {
      out.print(text);
      out.flush();
      if (out.checkError())
        throw new IOException("Error writing file " + outFile.getPath());
    }
  }
}
