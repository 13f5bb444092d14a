/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2025 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.cnmfe;

import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Locale;

import org.scijava.Context;
import org.scijava.log.LogService;

/** Static utilities for CNMF-E initialization **/
public class CNMFEUtils {

	private static Context context;
	private static LogService logService;
	private static boolean initialized;
	private static boolean debug;

	private CNMFEUtils() {}

	private static synchronized void initialize() {
		if (initialized) return;
		if (context == null) getContext();
		if (logService == null) logService = context.getService(LogService.class);
		initialized = true;
	}

	/**
	 * Retrieves the SciJava context used for logging. A minimal context is created
	 * on first access if none was set via {@link #setContext(Context)}.
	 *
	 * @return the SciJava context
	 */
	public static synchronized Context getContext() {
		if (context == null) {
			context = new Context(LogService.class);
		}
		return context;
	}

	public static synchronized void setContext(final Context context) {
		CNMFEUtils.context = context;
		logService = null;
		initialized = false;
	}

	public static synchronized void error(final String string) {
		if (!initialized) initialize();
		logService.error("[CNMF-E] " + string);
	}

	public static synchronized void error(final String string, final Throwable t) {
		if (!initialized) initialize();
		if (t == null)
			logService.error("[CNMF-E] " + string);
		else
			logService.error("[CNMF-E] " + string, t);
	}

	public static synchronized void log(final String string) {
		if (!isDebugMode()) return;
		if (!initialized) initialize();
		logService.info("[CNMF-E] " + string);
	}

	public static synchronized void warn(final String string) {
		if (!isDebugMode()) return;
		if (!initialized) initialize();
		logService.warn("[CNMF-E] " + string);
	}

	public static String formatDouble(final double value, final int digits) {
		return (Double.isNaN(value)) ? "NaN" : getDecimalFormat(value, digits).format(value);
	}

	public static DecimalFormat getDecimalFormat(final double value, final int digits) {
		final StringBuilder pattern = new StringBuilder("0.");
		while (pattern.length() < digits + 2)
			pattern.append("0");
		final double absValue = Math.abs(value);
		if ((absValue > 0 && absValue < 0.01) || absValue >= 1000) pattern.append("E0");
		final NumberFormat nf = NumberFormat.getNumberInstance(Locale.US);
		final DecimalFormat df = (DecimalFormat) nf;
		df.applyLocalizedPattern(pattern.toString());
		return df;
	}

	/**
	 * Assesses if debug mode is active
	 *
	 * @return the debug flag
	 */
	public static boolean isDebugMode() {
		return debug;
	}

	/**
	 * Enables/disables debug mode
	 *
	 * @param b verbose flag
	 */
	public static void setDebugMode(final boolean b) {
		if (isDebugMode() && !b) {
			log("Exiting debug mode...");
		}
		debug = b;
		if (isDebugMode()) {
			log("Entering debug mode...");
		}
	}

}
