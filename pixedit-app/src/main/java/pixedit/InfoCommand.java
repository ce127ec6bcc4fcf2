/*-
 * #%L
 * This file is part of PixEdit.
 * %%
 * Copyright (C) 2025 PixEdit developers
 * %%
 * PixEdit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * PixEdit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with PixEdit.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package pixedit;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import pixedit.lib.images.io.ImageDescription;
import pixedit.lib.images.io.ImageIoTools;

@Command(name = "info", description = "Print a summary of an image file.")
class InfoCommand implements Callable<Integer> {
	
	private final static Logger logger = LoggerFactory.getLogger(InfoCommand.class);
	
	@Spec
	private CommandSpec spec;
	
	@Parameters(index = "0", description = "Path to the image.", paramLabel = "image")
	private Path path;

	@Override
	public Integer call() throws Exception {
		var image = ImageIoTools.read(path);
		logger.debug("Describing {}", image);
		spec.commandLine().getOut().println(ImageDescription.describe(image));
		return 0;
	}

}
