package org.shirdrn.dm.medoids.common.utils;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.shirdrn.dm.medoids.common.DistanceMatrix;
import org.shirdrn.dm.medoids.common.Point2D;

import com.google.common.base.Charsets;
import com.google.common.base.Throwables;
import com.google.common.collect.Lists;
import com.google.common.io.Files;

public class FileUtils {

	private static final Log LOG = LogFactory.getLog(FileUtils.class);
	public static final String DEFAULT_DELIMITER_REGEX = "[\t,;\\s]+";

	/**
	 * Read a UTF-8 distance matrix, one row per line. Blank lines and lines starting
	 * with <code>#</code> are skipped.
	 * @param matrixFile
	 * @param delimiterRegex
	 * @return the parsed matrix
	 */
	public static DistanceMatrix readDistanceMatrix(File matrixFile, String delimiterRegex) {
		List<double[]> rows = Lists.newArrayList();
		BufferedReader reader = null;
		try {
			reader = Files.newReader(matrixFile.getAbsoluteFile(), Charsets.UTF_8);
			String line = null;
			int lineNumber = 0;
			while((line = reader.readLine()) != null) {
				lineNumber++;
				line = line.trim();
				if(line.isEmpty() || line.startsWith("#")) {
					continue;
				}
				String[] a = line.split(delimiterRegex);
				double[] row = new double[a.length];
				for (int i = 0; i < a.length; i++) {
					try {
						row[i] = Double.parseDouble(a[i]);
					} catch (NumberFormatException e) {
						throw new IllegalArgumentException("Bad distance '" + a[i] + "' at " + matrixFile + ":" + lineNumber, e);
					}
				}
				rows.add(row);
			}
		} catch (IOException e) {
			throw Throwables.propagate(e);
		} finally {
			FileUtils.closeQuietly(reader);
		}
		LOG.info("Distance matrix read: file=" + matrixFile + ", rows=" + rows.size());
		return new DistanceMatrix(rows.toArray(new double[rows.size()][]));
	}

	public static DistanceMatrix readDistanceMatrix(File matrixFile) {
		return readDistanceMatrix(matrixFile, DEFAULT_DELIMITER_REGEX);
	}

	/**
	 * Read lines from files, and parse line to create {@link Point2D} objects.
	 * Duplicated points are kept once.
	 * @param points
	 * @param delimiterRegex
	 * @param files
	 */
	public static void read2DPointsFromFiles(final List<Point2D> points, String delimiterRegex, File... files) {
		for(File file : files) {
			BufferedReader reader = null;
			try {
				reader = Files.newReader(file.getAbsoluteFile(), Charsets.UTF_8);
				String point = null;
				while((point = reader.readLine()) != null) {
					String[] a = point.trim().split(delimiterRegex);
					if(a.length == 2) {
						Point2D p = new Point2D(Double.parseDouble(a[0]), Double.parseDouble(a[1]));
						if(!points.contains(p)) {
							points.add(p);
						}
					}
				}
			} catch (IOException e) {
				throw Throwables.propagate(e);
			} finally {
				FileUtils.closeQuietly(reader);
			}
		}
	}

	public static void closeQuietly(Closeable... closeables) {
		if(closeables != null) {
			for(Closeable closeable : closeables) {
				if(closeable == null) {
					continue;
				}
				try {
					closeable.close();
				} catch (IOException e) {
					LOG.warn("Fail to close: " + closeable, e);
				}
			}
		}
	}
}
